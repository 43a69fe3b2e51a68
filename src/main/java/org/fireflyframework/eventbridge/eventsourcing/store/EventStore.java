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
import org.fireflyframework.eventbridge.exception.ConcurrencyConflictException;
import org.fireflyframework.eventbridge.exception.TenantIsolationException;
import org.fireflyframework.eventbridge.tenant.TenantId;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.UUID;

/**
 * Append-only, tenant-partitioned log of domain events per aggregate stream.
 * <p>
 * Every operation takes the tenant explicitly. Implementations filter every read
 * and write by that tenant, so a stream written under one tenant is invisible under
 * any other tenant even when the aggregate id is known.
 * <p>
 * Appends are guarded by optimistic concurrency: a batch is written only if the
 * stream's persisted version equals {@code expectedVersion} at commit time. Batches
 * are atomic and receive consecutive versions starting at {@code expectedVersion + 1}.
 * There is no deduplication by event id, so a retry with a stale expected version
 * fails as a conflict rather than appending twice.
 */
public interface EventStore {

    /**
     * Appends a batch of events to an aggregate stream.
     *
     * @param tenantId        the tenant performing the append
     * @param aggregateId     the aggregate stream
     * @param aggregateType   the aggregate type tag stored with each event
     * @param events          the events, in order; every event's metadata must name {@code tenantId}
     * @param expectedVersion the version the caller last observed, 0 for a new stream
     * @return the stored events of this batch, or an error: {@link ConcurrencyConflictException}
     *         on a version mismatch, {@link TenantIsolationException} if an event is tagged with
     *         another tenant
     */
    Mono<EventStream> appendEvents(TenantId tenantId, UUID aggregateId, String aggregateType,
                                   List<? extends AbstractDomainEvent> events, long expectedVersion);

    /**
     * Loads the full stream of an aggregate, ascending by version.
     * An empty stream means the aggregate does not exist for this tenant.
     */
    Mono<EventStream> loadEventStream(TenantId tenantId, UUID aggregateId);

    /**
     * Loads the events of an aggregate whose version is at least {@code fromVersion}.
     */
    Mono<EventStream> loadEventStream(TenantId tenantId, UUID aggregateId, long fromVersion);

    /**
     * Returns the persisted version of the aggregate, 0 if it has no events.
     */
    Mono<Long> getAggregateVersion(TenantId tenantId, UUID aggregateId);

    /**
     * Checks whether the underlying storage is reachable.
     */
    Mono<Boolean> isHealthy();
}
