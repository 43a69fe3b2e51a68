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
 * Thrown when an append is attempted with an expected version that no longer
 * matches the persisted version of the stream.
 * <p>
 * Recoverable: the caller reloads the aggregate, re-runs the command against
 * fresh state and appends with the new version. Retrying with the same expected
 * version always fails again.
 */
public class ConcurrencyConflictException extends EventBridgeException {

    public static final String ERROR_CODE = "CONCURRENCY_CONFLICT";

    private final UUID aggregateId;
    private final long expectedVersion;
    private final long actualVersion;

    public ConcurrencyConflictException(UUID aggregateId, long expectedVersion, long actualVersion) {
        super(ERROR_CODE, "Concurrency conflict on aggregate " + aggregateId
                + ": expected version " + expectedVersion + " but was " + actualVersion);
        this.aggregateId = aggregateId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public UUID getAggregateId() {
        return aggregateId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
