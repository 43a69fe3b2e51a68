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
 * Execution status of a process instance as seen by the bridge.
 */
public enum ProcessStatus {

    /**
     * Executing tasks.
     */
    RUNNING,

    /**
     * Suspended on a message subscription.
     */
    WAITING,

    /**
     * Reached the end of its main path or of an error boundary path.
     */
    COMPLETED,

    /**
     * Stopped by an error no boundary caught.
     */
    FAILED,

    /**
     * Cancelled by the engine while executing.
     */
    TERMINATED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == TERMINATED;
    }
}
