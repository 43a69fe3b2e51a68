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

package org.fireflyframework.eventbridge.eventsourcing.domain;

import java.time.Instant;
import java.util.UUID;

/**
 * Persisted form of a domain event.
 *
 * @param id            storage-assigned identifier
 * @param aggregateId   the owning aggregate
 * @param aggregateType the aggregate type tag
 * @param eventType     the event type tag used to pick the class on deserialization
 * @param payload       the serialized event as JSON
 * @param metadata      tenant, actor, correlation id and domain timestamp
 * @param version       1-based position in the aggregate's stream
 * @param createdAt     storage time, distinct from {@code metadata.timestamp}
 */
public record StoredEvent(
        UUID id,
        UUID aggregateId,
        String aggregateType,
        String eventType,
        String payload,
        EventMetadata metadata,
        long version,
        Instant createdAt
) {}
