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

package org.fireflyframework.eventbridge.eventsourcing.snapshot;

import java.time.Instant;
import java.util.UUID;

/**
 * Serialized state of an aggregate at a given stream version.
 * <p>
 * Loading an aggregate restores the snapshot and replays only the events whose
 * version is greater than {@code version}.
 *
 * @param aggregateId   the aggregate
 * @param aggregateType the aggregate type tag
 * @param version       the stream version the state reflects, at least 1
 * @param state         the state as JSON
 * @param createdAt     when the snapshot was taken
 */
public record AggregateSnapshot(
        UUID aggregateId,
        String aggregateType,
        long version,
        String state,
        Instant createdAt
) {

    public AggregateSnapshot {
        if (version <= 0) {
            throw new IllegalArgumentException("Snapshot version must be positive: " + version);
        }
    }
}
