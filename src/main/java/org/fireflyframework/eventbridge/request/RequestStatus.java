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

package org.fireflyframework.eventbridge.request;

/**
 * Lifecycle status of a resource request.
 * <p>
 * PENDING moves to APPROVED, REJECTED or CANCELLED. APPROVED moves to PROVISIONING,
 * which ends in READY or FAILED.
 */
public enum RequestStatus {

    /**
     * Submitted, awaiting an administrator's decision.
     */
    PENDING,

    /**
     * Approved, provisioning not started yet.
     */
    APPROVED,

    /**
     * Rejected by an administrator.
     */
    REJECTED,

    /**
     * Withdrawn before a decision was made.
     */
    CANCELLED,

    /**
     * Resource is being provisioned.
     */
    PROVISIONING,

    /**
     * Resource is provisioned and usable.
     */
    READY,

    /**
     * Provisioning failed.
     */
    FAILED;

    /**
     * Checks if this status is terminal (no further transitions except idempotent cancel).
     */
    public boolean isTerminal() {
        return this == REJECTED || this == CANCELLED || this == READY || this == FAILED;
    }

    /**
     * Checks if the request can still be cancelled from this status.
     */
    public boolean isCancellable() {
        return this == PENDING;
    }
}
