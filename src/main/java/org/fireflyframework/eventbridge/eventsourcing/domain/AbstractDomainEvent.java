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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.util.UUID;

/**
 * Base class for domain events.
 * <p>
 * Subclasses add their payload fields and declare their type tag with
 * {@link DomainEventType}. Events expose getters only and are never mutated after
 * construction; the no-args constructor exists for Jackson.
 */
@SuperBuilder
@Getter
@NoArgsConstructor
@AllArgsConstructor
public abstract class AbstractDomainEvent {

    /**
     * The aggregate this event belongs to.
     */
    private UUID aggregateId;

    /**
     * Tenant, actor, correlation id and domain timestamp.
     */
    private EventMetadata metadata;

    /**
     * Returns the type tag declared by {@link DomainEventType} on the concrete class.
     *
     * @throws IllegalStateException if the class is not annotated
     */
    @JsonIgnore
    public String getEventType() {
        return typeOf(getClass());
    }

    /**
     * Resolves the type tag of an event class.
     */
    public static String typeOf(Class<? extends AbstractDomainEvent> eventClass) {
        DomainEventType annotation = eventClass.getAnnotation(DomainEventType.class);
        if (annotation == null) {
            throw new IllegalStateException(
                    "Event class " + eventClass.getName() + " is not annotated with @DomainEventType");
        }
        return annotation.value();
    }
}
