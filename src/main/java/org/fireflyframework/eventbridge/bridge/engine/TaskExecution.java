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

import java.util.Optional;

/**
 * The running process instance as seen from inside a service task.
 */
public interface TaskExecution {

    String getProcessInstanceId();

    String getDefinitionKey();

    /**
     * Id of the service task node being executed.
     */
    String getActivityId();

    /**
     * The tenant the engine runs this instance under. This is engine context, not a
     * process variable, so a task cannot change it.
     */
    Optional<String> getTenantId();

    /**
     * Returns the variable value, or null if the variable is absent.
     */
    Object getVariable(String name);

    void setVariable(String name, Object value);
}
