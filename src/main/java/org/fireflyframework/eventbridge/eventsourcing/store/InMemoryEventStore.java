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

package org.fireflyframework.eventbridge.eventsourcing.store;

import org.fireflyframework.eventbridge.eventsourcing.domain.AbstractDomainEvent;
import org.fireflyframework.eventbridge.eventsourcing.domain.EventStream;
import org.fireflyframework.eventbridge.eventsourcing.domain.StoredEvent;
import org.fireflyframework.eventbridge.eventsourcing.serialization.EventSerializer;
import org.fireflyframework.eventbridge.exception.ConcurrencyConflictException;
import org.fireflyframework.eventbridge.tenant.TenantId;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link EventStore} backed by a concurrent map, one entry per tenant and aggregate.
 * <p>
 * The version check and the append run inside a single {@code compute} on the
 * stream's entry, which makes them atomic per stream without a global lock.
 * Streams are keyed by tenant first, so a lookup under the wrong tenant simply
 * finds nothing.
 */
@Slf4j
public class InMemoryEventStore implements EventStore {

    private final Map<StreamKey, List<StoredEvent>> streams = new ConcurrentHashMap<>();
    private final StoredEventFactory storedEventFactory;

    public InMemoryEventStore(EventSerializer serializer) {
        this.storedEventFactory = new StoredEventFactory(serializer);
    }

    @Override
    public Mono<EventStream> appendEvents(TenantId tenantId, UUID aggregateId, String aggregateType,
                                          List<? extends AbstractDomainEvent> events, long expectedVersion) {
        return Mono.fromCallable(() -> {
            storedEventFactory.validate(tenantId, aggregateId, events);
            if (events.isEmpty()) {
                return EventStream.empty(aggregateId);
            }

            List<StoredEvent> batch = storedEventFactory.toStoredEvents(aggregateId, aggregateType, events, expectedVersion);
            streams.compute(new StreamKey(tenantId, aggregateId), (key, existing) -> {
                long actualVersion = existing == null ? 0L : existing.size();
                if (actualVersion != expectedVersion) {
                    throw new ConcurrencyConflictException(aggregateId, expectedVersion, actualVersion);
                }
                List<StoredEvent> updated = existing == null ? new ArrayList<>() : new ArrayList<>(existing);
                updated.addAll(batch);
                return List.copyOf(updated);
            });

            log.debug("Appended events: tenant={}, aggregateId={}, count={}, newVersion={}",
                    tenantId, aggregateId, batch.size(), expectedVersion + batch.size());
            return new EventStream(aggregateId, batch);
        });
    }

    @Override
    public Mono<EventStream> loadEventStream(TenantId tenantId, UUID aggregateId) {
        return loadEventStream(tenantId, aggregateId, 1L);
    }

    @Override
    public Mono<EventStream> loadEventStream(TenantId tenantId, UUID aggregateId, long fromVersion) {
        return Mono.fromSupplier(() -> {
            List<StoredEvent> stream = streams.getOrDefault(new StreamKey(tenantId, aggregateId), List.of());
            return new EventStream(aggregateId, stream.stream()
                    .filter(event -> event.version() >= fromVersion)
                    .toList());
        });
    }

    @Override
    public Mono<Long> getAggregateVersion(TenantId tenantId, UUID aggregateId) {
        return Mono.fromSupplier(() ->
                (long) streams.getOrDefault(new StreamKey(tenantId, aggregateId), List.of()).size());
    }

    @Override
    public Mono<Boolean> isHealthy() {
        return Mono.just(true);
    }

    private record StreamKey(TenantId tenantId, UUID aggregateId) {}
}
