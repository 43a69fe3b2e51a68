/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.eventbridge.eventsourcing.snapshot;

import org.fireflyframework.eventbridge.eventsourcing.aggregate.AggregateRoot;
import org.fireflyframework.eventbridge.eventsourcing.serialization.EventSerializer;
import org.fireflyframework.eventbridge.tenant.TenantId;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.UUID;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Takes and restores snapshots of one aggregate type.
 * <p>
 * A snapshot is taken when a save moves the stream across a multiple of
 * {@code threshold}. Restoring builds an empty aggregate, installs the snapshot
 * state and version, and leaves the replay of later events to the caller.
 *
 * @param <A> the aggregate type
 */
@Slf4j
public class AggregateSnapshotter<A extends AggregateRoot<?>> {

    private final SnapshotStore snapshotStore;
    private final EventSerializer serializer;
    private final BiFunction<TenantId, AggregateSnapshot, A> restorer;

    @Getter
    private final int threshold;

    private AggregateSnapshotter(SnapshotStore snapshotStore,
                                 EventSerializer serializer,
                                 BiFunction<TenantId, AggregateSnapshot, A> restorer,
                                 int threshold) {
        if (threshold < 1) {
            throw new IllegalArgumentException("Snapshot threshold must be at least 1: " + threshold);
        }
        this.snapshotStore = snapshotStore;
        this.serializer = serializer;
        this.restorer = restorer;
        this.threshold = threshold;
    }

    /**
     * Creates a snapshotter for aggregates whose state is of type {@code stateType}.
     *
     * @param emptyAggregate creates an aggregate with no events applied
     */
    public static <A extends AggregateRoot<S>, S> AggregateSnapshotter<A> of(SnapshotStore snapshotStore,
                                                                              EventSerializer serializer,
                                                                              Class<S> stateType,
                                                                              Function<UUID, A> emptyAggregate,
                                                                              int threshold) {
        BiFunction<TenantId, AggregateSnapshot, A> restorer = (tenantId, snapshot) -> {
            A aggregate = emptyAggregate.apply(snapshot.aggregateId());
            aggregate.restoreFromSnapshot(
                    serializer.deserializeState(snapshot.state(), stateType),
                    snapshot.version(),
                    tenantId.value());
            return aggregate;
        };
        return new AggregateSnapshotter<>(snapshotStore, serializer, restorer, threshold);
    }

    /**
     * Returns true if a save from {@code previousVersion} to {@code newVersion}
     * crossed or reached a multiple of the threshold.
     */
    public boolean shouldSnapshot(long previousVersion, long newVersion) {
        return newVersion / threshold > previousVersion / threshold;
    }

    /**
     * Stores the aggregate's current state at its current version.
     */
    public Mono<Void> snapshot(TenantId tenantId, A aggregate) {
        return Mono.defer(() -> {
            AggregateSnapshot snapshot = new AggregateSnapshot(
                    aggregate.getId(),
                    aggregate.getAggregateType(),
                    aggregate.getCurrentVersion(),
                    serializer.serializeState(aggregate.getState()),
                    Instant.now());
            return snapshotStore.saveSnapshot(tenantId, snapshot);
        });
    }

    /**
     * Restores the aggregate from its latest snapshot.
     *
     * @return the aggregate at the snapshot version, or empty if there is no snapshot
     */
    public Mono<A> restore(TenantId tenantId, UUID aggregateId) {
        return snapshotStore.loadSnapshot(tenantId, aggregateId)
                .map(snapshot -> {
                    A aggregate = restorer.apply(tenantId, snapshot);
                    log.debug("Restored snapshot: type={}, id={}, version={}",
                            snapshot.aggregateType(), aggregateId, snapshot.version());
                    return aggregate;
                });
    }
}
