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

package org.fireflyframework.eventbridge.exception;

import java.util.UUID;

/**
 * Thrown when no event stream exists for an aggregate within the caller's tenant.
 * <p>
 * Streams owned by another tenant are invisible to the caller, so this is also what
 * a cross-tenant access looks like from outside.
 */
public class AggregateNotFoundException extends EventBridgeException {

    public static final String ERROR_CODE = "NOT_FOUND";

    private final UUID aggregateId;

    public AggregateNotFoundException(String aggregateType, UUID aggregateId) {
        super(ERROR_CODE, aggregateType + " not found: " + aggregateId);
        this.aggregateId = aggregateId;
    }

    public UUID getAggregateId() {
        return aggregateId;
    }
}
