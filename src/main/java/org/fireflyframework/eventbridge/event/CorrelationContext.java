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

package org.fireflyframework.eventbridge.event;

/**
 * Delivery metadata attached to an event when it is published. Never persisted.
 *
 * @param correlationKey  value matched against the business key of a waiting workflow instance
 * @param messageName     name of the message a waiting instance subscribes to
 * @param tenantId        tenant of the event
 */
public record CorrelationContext(
        String correlationKey,
        String messageName,
        String tenantId
) {

    public static final String CORRELATION_KEY = "correlationKey";
    public static final String MESSAGE_NAME = "messageName";
    public static final String TENANT_ID = "tenantId";

    public static CorrelationContext none(String tenantId) {
        return new CorrelationContext(null, null, tenantId);
    }

    /**
     * True if both correlation key and message name are present.
     */
    public boolean isRoutable() {
        return correlationKey != null && !correlationKey.isBlank()
                && messageName != null && !messageName.isBlank();
    }
}
