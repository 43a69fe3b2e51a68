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

package org.fireflyframework.eventbridge.bridge.engine;

/**
 * Engine-native business error raised by a service task.
 * <p>
 * Error boundaries in the process definition catch it by {@link #getErrorCode()}.
 * The message is safe to store in process variables and must not carry
 * tenant or other sensitive details.
 */
public class WorkflowTaskError extends RuntimeException {

    private final String errorCode;

    public WorkflowTaskError(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public WorkflowTaskError(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
