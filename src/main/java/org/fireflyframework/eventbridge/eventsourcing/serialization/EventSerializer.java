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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.fireflyframework.eventbridge.eventsourcing.domain.AbstractDomainEvent;
import org.fireflyframework.eventbridge.eventsourcing.domain.EventMetadata;
import org.fireflyframework.eventbridge.eventsourcing.domain.StoredEvent;
import org.fireflyframework.eventbridge.exception.EventStoreException;
import lombok.Getter;

import java.util.List;

/**
 * Converts domain events to and from their JSON payload.
 * <p>
 * The payload holds the complete event, metadata included, so a stored event can be
 * turned back into the exact object that was appended. The concrete class is chosen
 * from the stored event type via the {@link EventTypeRegistry}.
 */
public class EventSerializer {

    @Getter
    private final EventTypeRegistry typeRegistry;
    private final ObjectMapper objectMapper;

    public EventSerializer(EventTypeRegistry typeRegistry, ObjectMapper objectMapper) {
        this.typeRegistry = typeRegistry;
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String serialize(AbstractDomainEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new EventStoreException("Failed to serialize event " + event.getEventType(), e);
        }
    }

    public String serializeMetadata(EventMetadata metadata) {
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new EventStoreException("Failed to serialize event metadata", e);
        }
    }

    public EventMetadata deserializeMetadata(String json) {
        try {
            return objectMapper.readValue(json, EventMetadata.class);
        } catch (JsonProcessingException e) {
            throw new EventStoreException("Failed to deserialize event metadata", e);
        }
    }

    public AbstractDomainEvent deserialize(StoredEvent storedEvent) {
        Class<? extends AbstractDomainEvent> eventClass = typeRegistry.resolve(storedEvent.eventType())
                .orElseThrow(() -> new EventStoreException("Unknown event type: " + storedEvent.eventType()));
        try {
            return objectMapper.readValue(storedEvent.payload(), eventClass);
        } catch (JsonProcessingException e) {
            throw new EventStoreException("Failed to deserialize event " + storedEvent.eventType()
                    + " at version " + storedEvent.version() + " of aggregate " + storedEvent.aggregateId(), e);
        }
    }

    public List<AbstractDomainEvent> deserializeAll(List<StoredEvent> storedEvents) {
        return storedEvents.stream().map(this::deserialize).toList();
    }

    /**
     * Serializes an aggregate state value for a snapshot.
     */
    public String serializeState(Object state) {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new EventStoreException("Failed to serialize aggregate state " + state.getClass().getSimpleName(), e);
        }
    }

    public <S> S deserializeState(String json, Class<S> stateType) {
        try {
            return objectMapper.readValue(json, stateType);
        } catch (JsonProcessingException e) {
            throw new EventStoreException("Failed to deserialize aggregate state " + stateType.getSimpleName(), e);
        }
    }
}
