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
import org.fireflyframework.eventbridge.eventsourcing.domain.StoredEvent;
import org.fireflyframework.eventbridge.eventsourcing.serialization.EventSerializer;
import org.fireflyframework.eventbridge.exception.TenantIsolationException;
import org.fireflyframework.eventbridge.tenant.TenantId;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Validates an append batch and turns it into stored events with consecutive versions.
 */
@Slf4j
@RequiredArgsConstructor
class StoredEventFactory {

    private final EventSerializer serializer;

    /**
     * Checks that every event targets the aggregate and is tagged with the appending tenant.
     */
    void validate(TenantId tenantId, UUID aggregateId, List<? extends AbstractDomainEvent> events) {
        for (AbstractDomainEvent event : events) {
            if (!aggregateId.equals(event.getAggregateId())) {
                throw new IllegalArgumentException("Event " + event.getEventType()
                        + " targets aggregate " + event.getAggregateId() + ", not " + aggregateId);
            }
            if (event.getMetadata() == null || !tenantId.matches(event.getMetadata().tenantId())) {
                log.debug("Rejected append: aggregateId={}, tenant={}, eventTenant={}",
                        aggregateId, tenantId, event.getMetadata() != null ? event.getMetadata().tenantId() : null);
                throw new TenantIsolationException();
            }
        }
    }

    List<StoredEvent> toStoredEvents(UUID aggregateId, String aggregateType,
                                     List<? extends AbstractDomainEvent> events, long expectedVersion) {
        Instant createdAt = Instant.now();
        List<StoredEvent> stored = new ArrayList<>(events.size());
        long version = expectedVersion;
        for (AbstractDomainEvent event : events) {
            version++;
            stored.add(new StoredEvent(
                    UUID.randomUUID(),
                    aggregateId,
                    aggregateType,
                    event.getEventType(),
                    serializer.serialize(event),
                    event.getMetadata(),
                    version,
                    createdAt));
        }
        return stored;
    }
}
