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
import org.fireflyframework.eventbridge.bridge.engine.inmemory.ProcessNode.ReceiveMessageNode;
import org.fireflyframework.eventbridge.bridge.engine.inmemory.ProcessNode.ServiceTaskNode;
import org.fireflyframework.eventbridge.bridge.engine.inmemory.ProcessNode.SetVariablesNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A linear process definition for the {@link InMemoryWorkflowRuntime}.
 * <p>
 * Example:
 * <pre>{@code
 * ProcessDefinition definition = ProcessDefinition.builder("resource-request")
 *     .setVariables("prepare", Map.of("commandClassName", "request.approve",
 *         "constructorParameters", List.of("tenantId", "requestId", "adminId")))
 *     .serviceTask("approve", dispatchTask,
 *         compensationOverlay.onError("FORBIDDEN", "request.cancel",
 *             List.of("tenantId", "requestId", "userId", "reason"), Map.of("reason", "auto")))
 *     .receiveMessage("await-ready", "ResourceReady")
 *     .build();
 * }</pre>
 */
public record ProcessDefinition(String key, List<ProcessNode> nodes) {

    public ProcessDefinition {
        Objects.requireNonNull(key, "key must not be null");
        nodes = List.copyOf(nodes);
    }

    public static Builder builder(String key) {
        return new Builder(key);
    }

    public static final class Builder {

        private final String key;
        private final List<ProcessNode> nodes = new ArrayList<>();

        private Builder(String key) {
            this.key = key;
        }

        public Builder serviceTask(String id, WorkflowTask task, ErrorBoundary... boundaries) {
            nodes.add(new ServiceTaskNode(id, task, List.of(boundaries)));
            return this;
        }

        public Builder receiveMessage(String id, String messageName) {
            nodes.add(new ReceiveMessageNode(id, messageName));
            return this;
        }

        public Builder setVariables(String id, Map<String, Object> variables) {
            nodes.add(new SetVariablesNode(id, variables));
            return this;
        }

        public ProcessDefinition build() {
            Set<String> ids = new HashSet<>();
            for (ProcessNode node : nodes) {
                if (!ids.add(node.id())) {
                    throw new IllegalStateException("Duplicate node id '" + node.id() + "' in process " + key);
                }
            }
            return new ProcessDefinition(key, nodes);
        }
    }
}
