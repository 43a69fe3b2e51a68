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

package org.fireflyframework.eventbridge.request;

import lombok.With;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable state of a resource request, folded from its events.
 * <p>
 * {@code status} is null until the creation event has been applied.
 */
@With
public record ResourceRequestState(
        UUID requestId,
        RequestStatus status,
        String requesterId,
        UUID projectId,
        String resourceName,
        String resourceSize,
        String justification,
        String decidedBy,
        String decisionReason,
        String resourceId,
        String address,
        String failureCode,
        String failureMessage,
        Instant createdAt,
        Instant updatedAt
) {

    public static ResourceRequestState initial(UUID requestId) {
        return new ResourceRequestState(requestId, null, null, null, null, null, null,
                null, null, null, null, null, null, null, null);
    }

    public boolean isCreated() {
        return status != null;
    }
}
