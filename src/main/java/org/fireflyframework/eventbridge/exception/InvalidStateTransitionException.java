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

/**
 * Thrown when an operation is not valid in the aggregate's current state.
 */
public class InvalidStateTransitionException extends EventBridgeException {

    public static final String ERROR_CODE = "INVALID_STATE";

    private final String currentState;
    private final String operation;

    public InvalidStateTransitionException(String currentState, String operation) {
        super(ERROR_CODE, "Cannot " + operation + " when status is " + currentState);
        this.currentState = currentState;
        this.operation = operation;
    }

    public String getCurrentState() {
        return currentState;
    }

    public String getOperation() {
        return operation;
    }
}
