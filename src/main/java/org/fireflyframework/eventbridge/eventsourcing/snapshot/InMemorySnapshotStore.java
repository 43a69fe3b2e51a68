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

import org.fireflyframework.eventbridge.tenant.TenantId;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link SnapshotStore} backed by a concurrent map keyed by tenant and aggregate.
 */
@Slf4j
public class InMemorySnapshotStore implements SnapshotStore {

    private final Map<SnapshotKey, AggregateSnapshot> snapshots = new ConcurrentHashMap<>();

    @Override
    public Mono<Void> saveSnapshot(TenantId tenantId, AggregateSnapshot snapshot) {
        return Mono.fromRunnable(() -> {
            snapshots.merge(new SnapshotKey(tenantId, snapshot.aggregateId()), snapshot,
                    (existing, candidate) -> candidate.version() > existing.version() ? candidate : existing);
            log.debug("Saved snapshot: tenant={}, aggregateId={}, version={}",
                    tenantId, snapshot.aggregateId(), snapshot.version());
        });
    }

    @Override
    public Mono<AggregateSnapshot> loadSnapshot(TenantId tenantId, UUID aggregateId) {
        return Mono.fromCallable(() -> snapshots.get(new SnapshotKey(tenantId, aggregateId)));
    }

    private record SnapshotKey(TenantId tenantId, UUID aggregateId) {}
}
