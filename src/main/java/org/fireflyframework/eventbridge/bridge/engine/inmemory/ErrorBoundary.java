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

package org.fireflyframework.eventbridge.bridge.engine.inmemory;

import java.util.List;

/**
 * Error boundary attached to a service task.
 * <p>
 * When the task raises a {@code WorkflowTaskError} whose code matches, the main path
 * is abandoned and {@link #path()} runs instead. A null error code catches every code.
 *
 * @param errorCode the code to catch, or null for a catch-all boundary
 * @param path      nodes to run after the error is caught
 */
public record ErrorBoundary(String errorCode, List<ProcessNode> path) {

    public ErrorBoundary {
        path = path == null ? List.of() : List.copyOf(path);
    }

    public static ErrorBoundary on(String errorCode, ProcessNode... path) {
        return new ErrorBoundary(errorCode, List.of(path));
    }

    public static ErrorBoundary catchAll(ProcessNode... path) {
        return new ErrorBoundary(null, List.of(path));
    }

    public boolean isCatchAll() {
        return errorCode == null;
    }
}
