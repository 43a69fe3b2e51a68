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

import org.fireflyframework.eventbridge.bridge.engine.WorkflowTask;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A step of a {@link ProcessDefinition} path.
 */
public interface ProcessNode {

    String id();

    /**
     * Invokes a {@link WorkflowTask}. Errors raised by the task are matched against
     * the boundaries in declaration order, exact codes before catch-alls.
     */
    record ServiceTaskNode(String id, WorkflowTask task, List<ErrorBoundary> boundaries) implements ProcessNode {

        public ServiceTaskNode {
            Objects.requireNonNull(id, "id must not be null");
            Objects.requireNonNull(task, "task must not be null");
            boundaries = boundaries == null ? List.of() : List.copyOf(boundaries);
        }
    }

    /**
     * Suspends the instance until the named message is delivered.
     */
    record ReceiveMessageNode(String id, String messageName) implements ProcessNode {

        public ReceiveMessageNode {
            Objects.requireNonNull(id, "id must not be null");
            Objects.requireNonNull(messageName, "messageName must not be null");
        }
    }

    /**
     * Writes fixed values into the process variables.
     */
    record SetVariablesNode(String id, Map<String, Object> variables) implements ProcessNode {

        public SetVariablesNode {
            Objects.requireNonNull(id, "id must not be null");
            variables = variables == null ? Map.of() : Map.copyOf(variables);
        }
    }
}
