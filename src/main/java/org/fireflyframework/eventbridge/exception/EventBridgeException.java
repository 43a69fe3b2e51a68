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
 * Base exception for event bridge errors.
 * <p>
 * Every subclass carries a stable error code. The command dispatch bridge turns
 * these codes into workflow error signals, so each distinct failure cause must
 * map to exactly one code.
 */
public class EventBridgeException extends RuntimeException {

    private final String errorCode;

    public EventBridgeException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public EventBridgeException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
