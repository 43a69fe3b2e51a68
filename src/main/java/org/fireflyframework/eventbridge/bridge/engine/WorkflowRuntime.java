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

import org.fireflyframework.eventbridge.tenant.TenantId;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Contract with the workflow engine.
 * <p>
 * The bridge is both a user of the engine (it provides {@link WorkflowTask}
 * implementations the engine invokes) and a caller of it (it resumes waiting
 * instances when domain events arrive). Adapters for a concrete engine implement
 * this interface; {@code InMemoryWorkflowRuntime} is the built-in implementation.
 */
public interface WorkflowRuntime {

    /**
     * Starts an instance and runs it until it waits on a message or ends.
     *
     * @param definitionKey the process definition
     * @param businessKey   external identifier used for message correlation
     * @param tenantId      the engine tenant of the instance
     * @param variables     initial process variables
     */
    Mono<ProcessInstance> startInstance(String definitionKey, String businessKey, TenantId tenantId,
                                        Map<String, Object> variables);

    /**
     * Finds the instance with the given business key that is subscribed to {@code messageName}.
     *
     * @return the instance, or empty if none waits for that message
     */
    Mono<ProcessInstance> findWaitingInstance(String messageName, String correlationKey);

    /**
     * Like {@link #findWaitingInstance(String, String)}, but when instances of several tenants
     * wait under the same business key, one of {@code tenantId} is returned. Engines that do
     * not track tenants fall back to the plain lookup.
     */
    default Mono<ProcessInstance> findWaitingInstance(String messageName, String correlationKey,
                                                      @Nullable String tenantId) {
        return findWaitingInstance(messageName, correlationKey);
    }

    /**
     * Delivers a message to an instance and resumes it. The subscription is consumed
     * atomically, so a message is delivered at most once.
     *
     * @return completes when the instance has advanced, errors with
     *         {@link WorkflowEngineException} if the instance does not wait for the message
     */
    Mono<Void> deliverMessage(String instanceId, String messageName, Map<String, Object> variables);

    /**
     * Finds the waiting instance and delivers the message to it, without any tenant check.
     *
     * @return true if an instance was resumed
     */
    default Mono<Boolean> signalWaitingInstance(String messageName, String correlationKey,
                                                Map<String, Object> variables) {
        return findWaitingInstance(messageName, correlationKey)
                .flatMap(instance -> deliverMessage(instance.id(), messageName, variables).thenReturn(true))
                .defaultIfEmpty(false);
    }

    Mono<ProcessInstance> getInstance(String instanceId);

    /**
     * @return the value, or empty if the variable or the instance does not exist
     */
    Mono<Object> getVariable(String instanceId, String name);

    Mono<Map<String, Object>> getVariables(String instanceId);

    Mono<Void> setVariable(String instanceId, String name, Object value);
}
