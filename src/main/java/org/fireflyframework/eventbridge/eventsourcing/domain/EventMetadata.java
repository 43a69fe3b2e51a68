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

import org.fireflyframework.eventbridge.tenant.TenantId;

import java.time.Instant;
import java.util.Objects;

/**
 * Who caused an event, for which tenant, and when.
 *
 * @param tenantId      the owning tenant, immutable once the event is persisted
 * @param userId        the user or system actor that caused the event
 * @param correlationId the tracing correlation id, may be null
 * @param timestamp     the domain time of the event
 */
public record EventMetadata(
        String tenantId,
        String userId,
        String correlationId,
        Instant timestamp
) {

    public EventMetadata {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static EventMetadata of(TenantId tenantId, String userId, String correlationId) {
        return new EventMetadata(tenantId.value(), userId, correlationId, Instant.now());
    }
}
