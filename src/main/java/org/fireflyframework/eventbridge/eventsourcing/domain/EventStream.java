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

import java.util.List;
import java.util.UUID;

/**
 * An ordered slice of an aggregate's stored events, ascending by version.
 *
 * @param aggregateId the aggregate
 * @param events      the events in version order, possibly empty
 */
public record EventStream(UUID aggregateId, List<StoredEvent> events) {

    public EventStream {
        events = List.copyOf(events);
    }

    public static EventStream empty(UUID aggregateId) {
        return new EventStream(aggregateId, List.of());
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    /**
     * Version of the last event in this slice, or 0 when empty.
     */
    public long getVersion() {
        return events.isEmpty() ? 0L : events.get(events.size() - 1).version();
    }
}
