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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.eventbridge.bridge.engine.ProcessInstance;
import org.fireflyframework.eventbridge.bridge.engine.TaskExecution;
import org.fireflyframework.eventbridge.bridge.engine.WorkflowEngineException;
import org.fireflyframework.eventbridge.bridge.engine.WorkflowRuntime;
import org.fireflyframework.eventbridge.bridge.engine.WorkflowTaskError;
import org.fireflyframework.eventbridge.bridge.engine.inmemory.ProcessNode.ReceiveMessageNode;
import org.fireflyframework.eventbridge.bridge.engine.inmemory.ProcessNode.ServiceTaskNode;
import org.fireflyframework.eventbridge.bridge.engine.inmemory.ProcessNode.SetVariablesNode;
import org.fireflyframework.eventbridge.tenant.TenantId;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Workflow runtime that executes linear {@link ProcessDefinition}s in memory.
 * <p>
 * Instances run on the subscribing thread until they reach a receive-message node or
 * the end of a path. A {@link WorkflowTaskError} raised by a service task is routed to
 * the matching {@link ErrorBoundary}; the error code and message are then available as
 * the {@value #ERROR_CODE_VARIABLE} and {@value #ERROR_MESSAGE_VARIABLE} variables.
 * Unhandled errors fail the instance. Cancellation of the subscriber terminates the
 * instance instead of failing it.
 */
@Slf4j
public class InMemoryWorkflowRuntime implements WorkflowRuntime {

    public static final String ERROR_CODE_VARIABLE = "errorCode";
    public static final String ERROR_MESSAGE_VARIABLE = "errorMessage";

    /**
     * Error code recorded on instances failed by an error that is not a {@link WorkflowTaskError}.
     */
    public static final String INCIDENT_ERROR_CODE = "INCIDENT";

    private static final String TENANT_VARIABLE = "tenantId";

    private final Map<String, ProcessDefinition> definitions = new ConcurrentHashMap<>();
    private final Map<String, InstanceState> instances = new ConcurrentHashMap<>();

    public InMemoryWorkflowRuntime deploy(ProcessDefinition definition) {
        if (definitions.putIfAbsent(definition.key(), definition) != null) {
            throw new IllegalStateException("Process definition already deployed: " + definition.key());
        }
        log.info("Deployed process definition: {} ({} nodes)", definition.key(), definition.nodes().size());
        return this;
    }

    @Override
    public Mono<ProcessInstance> startInstance(String definitionKey, String businessKey, TenantId tenantId,
                                               Map<String, Object> variables) {
        return Mono.defer(() -> {
            ProcessDefinition definition = definitions.get(definitionKey);
            if (definition == null) {
                return Mono.error(new WorkflowEngineException("Unknown process definition: " + definitionKey));
            }
            InstanceState state = new InstanceState(UUID.randomUUID().toString(), definitionKey, businessKey,
                    tenantId != null ? tenantId.value() : null, variables);
            instances.put(state.id(), state);
            log.info("Started process instance {} of {} for business key {}", state.id(), definitionKey, businessKey);

            return execute(state, definition.nodes(), 0)
                    .then(Mono.fromSupplier(state::snapshot));
        });
    }

    @Override
    public Mono<ProcessInstance> findWaitingInstance(String messageName, String correlationKey) {
        return Mono.fromSupplier(() -> instances.values().stream()
                        .filter(state -> state.isWaitingFor(messageName, correlationKey))
                        .findFirst()
                        .map(InstanceState::snapshot))
                .flatMap(Mono::justOrEmpty);
    }

    @Override
    public Mono<ProcessInstance> findWaitingInstance(String messageName, String correlationKey,
                                                     @Nullable String tenantId) {
        if (tenantId == null) {
            return findWaitingInstance(messageName, correlationKey);
        }
        return Mono.fromSupplier(() -> instances.values().stream()
                        .filter(state -> state.isWaitingFor(messageName, correlationKey))
                        .min(Comparator.comparing((InstanceState state) -> !belongsTo(state, tenantId)))
                        .map(InstanceState::snapshot))
                .flatMap(Mono::justOrEmpty);
    }

    private static boolean belongsTo(InstanceState state, String tenantId) {
        if (state.tenantId() != null) {
            return state.tenantId().equals(tenantId);
        }
        Object variable = state.getVariable(TENANT_VARIABLE);
        String variableTenant = variable instanceof TenantId typed ? typed.value()
                : variable instanceof String s ? s : null;
        return tenantId.equals(variableTenant);
    }

    @Override
    public Mono<Void> deliverMessage(String instanceId, String messageName, Map<String, Object> variables) {
        return Mono.defer(() -> {
            InstanceState state = instances.get(instanceId);
            if (state == null) {
                return Mono.error(new WorkflowEngineException("Process instance not found: " + instanceId));
            }
            InstanceState.Continuation continuation = state.claim(messageName);
            if (continuation == null) {
                return Mono.error(new WorkflowEngineException(
                        "Process instance " + instanceId + " is not waiting for message " + messageName));
            }
            state.putVariables(variables);
            log.debug("Message '{}' delivered to process instance {}", messageName, instanceId);
            return execute(state, continuation.path(), continuation.index() + 1);
        });
    }

    @Override
    public Mono<ProcessInstance> getInstance(String instanceId) {
        return Mono.fromSupplier(() -> instances.get(instanceId))
                .map(InstanceState::snapshot);
    }

    @Override
    public Mono<Object> getVariable(String instanceId, String name) {
        return Mono.fromSupplier(() -> instances.get(instanceId))
                .flatMap(state -> Mono.justOrEmpty(state.getVariable(name)));
    }

    @Override
    public Mono<Map<String, Object>> getVariables(String instanceId) {
        return getInstance(instanceId).map(ProcessInstance::variables);
    }

    @Override
    public Mono<Void> setVariable(String instanceId, String name, Object value) {
        return Mono.defer(() -> {
            InstanceState state = instances.get(instanceId);
            if (state == null) {
                return Mono.error(new WorkflowEngineException("Process instance not found: " + instanceId));
            }
            state.setVariable(name, value);
            return Mono.empty();
        });
    }

    private Mono<Void> execute(InstanceState state, List<ProcessNode> path, int index) {
        return run(state, path, index)
                .doOnCancel(state::terminate)
                .onErrorResume(error -> !(error instanceof CancellationException), error -> {
                    log.error("Process instance {} of {} failed with an incident",
                            state.id(), state.definitionKey(), error);
                    state.fail(INCIDENT_ERROR_CODE);
                    return Mono.empty();
                })
                .doOnError(CancellationException.class, error -> state.terminate());
    }

    private Mono<Void> run(InstanceState state, List<ProcessNode> path, int index) {
        return Mono.defer(() -> {
            if (index >= path.size()) {
                state.complete();
                log.debug("Process instance {} completed", state.id());
                return Mono.empty();
            }
            ProcessNode node = path.get(index);

            if (node instanceof SetVariablesNode setVariables) {
                state.putVariables(setVariables.variables());
                return run(state, path, index + 1);
            }
            if (node instanceof ReceiveMessageNode receive) {
                state.await(receive.messageName(), path, index);
                log.debug("Process instance {} waiting for message '{}' at {}",
                        state.id(), receive.messageName(), receive.id());
                return Mono.empty();
            }

            ServiceTaskNode taskNode = (ServiceTaskNode) node;
            TaskExecution execution = new InMemoryTaskExecution(state, taskNode.id());
            return Mono.defer(() -> taskNode.task().execute(execution))
                    .then(Mono.fromSupplier(() -> new Route(path, index + 1)))
                    .onErrorResume(WorkflowTaskError.class, error -> route(state, taskNode, error))
                    .flatMap(route -> run(state, route.path(), route.index()));
        });
    }

    private Mono<Route> route(InstanceState state, ServiceTaskNode taskNode, WorkflowTaskError error) {
        state.recordError(error.getErrorCode());
        Optional<ErrorBoundary> boundary = findBoundary(taskNode, error.getErrorCode());
        if (boundary.isEmpty()) {
            log.warn("Process instance {} failed at {}: unhandled error {}",
                    state.id(), taskNode.id(), error.getErrorCode());
            state.fail(error.getErrorCode());
            return Mono.empty();
        }
        log.info("Process instance {} caught error {} at {}", state.id(), error.getErrorCode(), taskNode.id());
        state.setVariable(ERROR_CODE_VARIABLE, error.getErrorCode());
        state.setVariable(ERROR_MESSAGE_VARIABLE, error.getMessage());
        return Mono.just(new Route(boundary.get().path(), 0));
    }

    private Optional<ErrorBoundary> findBoundary(ServiceTaskNode taskNode, String errorCode) {
        Optional<ErrorBoundary> exact = taskNode.boundaries().stream()
                .filter(boundary -> !boundary.isCatchAll() && boundary.errorCode().equals(errorCode))
                .findFirst();
        if (exact.isPresent()) {
            return exact;
        }
        return taskNode.boundaries().stream().filter(ErrorBoundary::isCatchAll).findFirst();
    }

    private record Route(List<ProcessNode> path, int index) {
    }

    private record InMemoryTaskExecution(InstanceState state, String activityId) implements TaskExecution {

        @Override
        public String getProcessInstanceId() {
            return state.id();
        }

        @Override
        public String getDefinitionKey() {
            return state.definitionKey();
        }

        @Override
        public String getActivityId() {
            return activityId;
        }

        @Override
        public Optional<String> getTenantId() {
            return Optional.ofNullable(state.tenantId());
        }

        @Override
        public Object getVariable(String name) {
            return state.getVariable(name);
        }

        @Override
        public void setVariable(String name, Object value) {
            state.setVariable(name, value);
        }
    }
}
