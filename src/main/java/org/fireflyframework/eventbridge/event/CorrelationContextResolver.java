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

import org.fireflyframework.eventbridge.eventsourcing.domain.StoredEvent;

import java.util.Map;

/**
 * Derives the {@link CorrelationContext} of a committed event.
 * <p>
 * The message name comes from a configured event type to message name mapping;
 * events without a mapping are not meant for any workflow. The correlation key is
 * the aggregate id, which workflows driving an aggregate use as their business key.
 */
public class CorrelationContextResolver {

    private final Map<String, String> messageNames;

    public CorrelationContextResolver(Map<String, String> messageNames) {
        this.messageNames = Map.copyOf(messageNames);
    }

    public CorrelationContext resolve(StoredEvent storedEvent) {
        String tenantId = storedEvent.metadata() != null ? storedEvent.metadata().tenantId() : null;
        String messageName = messageNames.get(storedEvent.eventType());
        if (messageName == null) {
            return CorrelationContext.none(tenantId);
        }
        return new CorrelationContext(storedEvent.aggregateId().toString(), messageName, tenantId);
    }
}
