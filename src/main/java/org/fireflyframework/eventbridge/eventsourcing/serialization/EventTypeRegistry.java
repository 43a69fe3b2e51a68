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

package org.fireflyframework.eventbridge.eventsourcing.serialization;

import org.fireflyframework.eventbridge.eventsourcing.domain.AbstractDomainEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps event type tags to event classes for polymorphic deserialization.
 * <p>
 * Registration fails on a tag that is already bound to a different class, since
 * two classes sharing a tag would make replay ambiguous.
 */
@Slf4j
public class EventTypeRegistry {

    private final Map<String, Class<? extends AbstractDomainEvent>> eventTypes = new ConcurrentHashMap<>();

    public EventTypeRegistry register(Class<? extends AbstractDomainEvent> eventClass) {
        String eventType = AbstractDomainEvent.typeOf(eventClass);
        Class<? extends AbstractDomainEvent> existing = eventTypes.putIfAbsent(eventType, eventClass);
        if (existing != null && !existing.equals(eventClass)) {
            throw new IllegalStateException("Event type '" + eventType + "' is already registered to "
                    + existing.getName() + ", cannot register " + eventClass.getName());
        }
        log.debug("Registered event type: {} -> {}", eventType, eventClass.getName());
        return this;
    }

    public EventTypeRegistry registerAll(Collection<Class<? extends AbstractDomainEvent>> eventClasses) {
        eventClasses.forEach(this::register);
        return this;
    }

    public Optional<Class<? extends AbstractDomainEvent>> resolve(String eventType) {
        return Optional.ofNullable(eventTypes.get(eventType));
    }

    public Set<String> getRegisteredTypes() {
        return Set.copyOf(eventTypes.keySet());
    }
}
