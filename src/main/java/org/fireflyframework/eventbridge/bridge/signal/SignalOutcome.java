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

package org.fireflyframework.eventbridge.bridge.signal;

/**
 * What the {@link EventSignalBridge} did with one event.
 *
 * @param status            the outcome
 * @param processInstanceId the targeted instance, null when none was found
 */
public record SignalOutcome(Status status, String processInstanceId) {

    public enum Status {
        /** The event carries no routing metadata. */
        SKIPPED,
        /** No instance waits for the message with that correlation key. */
        NO_WAITING_INSTANCE,
        /** The instance belongs to another tenant; the signal was dropped. */
        TENANT_MISMATCH,
        /** The instance was resumed. */
        DELIVERED,
        /** The engine rejected or failed the delivery. */
        DELIVERY_FAILED
    }

    static SignalOutcome of(Status status) {
        return new SignalOutcome(status, null);
    }

    static SignalOutcome of(Status status, String processInstanceId) {
        return new SignalOutcome(status, processInstanceId);
    }

    public boolean isDelivered() {
        return status == Status.DELIVERED;
    }
}
