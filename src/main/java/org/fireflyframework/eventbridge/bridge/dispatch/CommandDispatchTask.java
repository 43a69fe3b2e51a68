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

package org.fireflyframework.eventbridge.bridge.dispatch;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.eventbridge.bridge.engine.TaskExecution;
import org.fireflyframework.eventbridge.bridge.engine.WorkflowTask;
import org.fireflyframework.eventbridge.bridge.engine.WorkflowTaskError;
import org.fireflyframework.eventbridge.command.Command;
import org.fireflyframework.eventbridge.command.CommandGateway;
import org.fireflyframework.eventbridge.command.CommandResult;
import org.fireflyframework.eventbridge.exception.EventBridgeException;
import org.fireflyframework.eventbridge.exception.InvalidInputException;
import org.fireflyframework.eventbridge.metrics.BridgeMetrics;
import org.fireflyframework.eventbridge.tenant.TenantId;
import org.fireflyframework.eventbridge.tracing.BridgeTracer;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

import static org.fireflyframework.eventbridge.bridge.dispatch.DispatchErrorCodes.*;

/**
 * Generic service task that builds a command from process variables and sends it
 * through the {@link CommandGateway}.
 * <p>
 * Variable contract:
 * <ul>
 *   <li>{@value #COMMAND_CLASS_NAME}: registry key of the command</li>
 *   <li>{@value #CONSTRUCTOR_PARAMETERS}: list of parameter names, bound by name in any order</li>
 *   <li>one variable per listed parameter</li>
 *   <li>{@value #COMMAND_RESULT}: written by the task, {@code SUCCESS} or an error code</li>
 * </ul>
 * Every failure is raised as a {@link WorkflowTaskError} carrying one code from
 * {@link DispatchErrorCodes}, so the process definition decides how to react. The task
 * never retries. Cancellation is not converted.
 */
@Slf4j
public class CommandDispatchTask implements WorkflowTask {

    public static final String COMMAND_CLASS_NAME = "commandClassName";
    public static final String CONSTRUCTOR_PARAMETERS = "constructorParameters";
    public static final String COMMAND_RESULT = "commandResult";

    private static final String UNKNOWN_COMMAND_TAG = "unknown";

    private final CommandRegistry registry;
    private final CommandGateway gateway;
    private final ObjectMapper objectMapper;
    private final TimeLimiter timeLimiter;
    private final BridgeMetrics metrics;
    private final BridgeTracer tracer;

    public CommandDispatchTask(CommandRegistry registry,
                               CommandGateway gateway,
                               ObjectMapper objectMapper,
                               @Nullable TimeLimiter timeLimiter,
                               @Nullable BridgeMetrics metrics,
                               @Nullable BridgeTracer tracer) {
        this.registry = registry;
        this.gateway = gateway;
        this.objectMapper = objectMapper;
        this.timeLimiter = timeLimiter;
        this.metrics = metrics;
        this.tracer = tracer;
    }

    @Override
    public Mono<Void> execute(TaskExecution execution) {
        return Mono.defer(() -> {
            long startNanos = System.nanoTime();
            Object keyVariable = execution.getVariable(COMMAND_CLASS_NAME);
            CommandDescriptor descriptor = registry.resolve(keyVariable instanceof String s ? s : null).orElse(null);
            if (descriptor == null) {
                // unresolved keys are not used as metric tags
                return fail(execution, UNKNOWN_COMMAND_TAG,
                        new WorkflowTaskError(UNKNOWN_COMMAND, "Unknown workflow command: " + keyVariable), startNanos);
            }

            Command command;
            try {
                command = buildCommand(descriptor, execution);
            } catch (WorkflowTaskError error) {
                return fail(execution, descriptor.key(), error, startNanos);
            }

            if (descriptor.compensating() && metrics != null) {
                metrics.recordCompensationCommand(descriptor.key());
            }
            log.debug("Dispatching workflow command: key={}, processInstanceId={}, activityId={}",
                    descriptor.key(), execution.getProcessInstanceId(), execution.getActivityId());

            Mono<CommandResult> dispatch = withTimeLimit(descriptor.key(),
                    Mono.defer(() -> gateway.send(command, execution.getProcessInstanceId())));
            if (tracer != null) {
                dispatch = tracer.traceDispatch(descriptor.key(), execution.getProcessInstanceId(),
                        execution.getActivityId(), dispatch);
            }

            return dispatch
                    .doOnNext(result -> {
                        execution.setVariable(COMMAND_RESULT, SUCCESS);
                        recordOutcome(descriptor.key(), SUCCESS, startNanos);
                        log.debug("Workflow command {} succeeded: aggregateId={}, version={}",
                                descriptor.key(), result.aggregateId(), result.version());
                    })
                    .then()
                    .onErrorResume(error -> !(error instanceof CancellationException),
                            error -> fail(execution, descriptor.key(), toTaskError(descriptor.key(), error), startNanos));
        });
    }

    // ==================== Command construction ====================

    private Command buildCommand(CommandDescriptor descriptor, TaskExecution execution) {
        List<String> names = parameterNames(execution);

        for (String name : names) {
            if (execution.getVariable(name) == null) {
                throw new WorkflowTaskError(MISSING_VARIABLE, "Missing process variable: " + name);
            }
        }

        // bound by name, so the listed order is free
        for (String required : descriptor.parameterNames()) {
            if (!names.contains(required)) {
                throw new WorkflowTaskError(MISSING_VARIABLE, "Missing constructor parameter: " + required);
            }
        }
        Set<String> unknown = new LinkedHashSet<>(names);
        descriptor.parameterNames().forEach(unknown::remove);
        if (!unknown.isEmpty() || new HashSet<>(names).size() != names.size()) {
            throw new WorkflowTaskError(PARAMETER_MISMATCH, "Parameters " + names + " do not match command "
                    + descriptor.key() + " parameters " + descriptor.parameterNames());
        }

        verifyTenant(execution);

        List<CommandParameter> parameters = descriptor.parameters();
        Object[] arguments = new Object[parameters.size()];
        for (int i = 0; i < parameters.size(); i++) {
            arguments[i] = convert(parameters.get(i), execution.getVariable(parameters.get(i).name()));
        }

        try {
            return descriptor.newInstance(arguments);
        } catch (EventBridgeException e) {
            throw new WorkflowTaskError(e.getErrorCode(), e.getMessage(), e);
        } catch (RuntimeException e) {
            log.debug("Command {} could not be constructed: {}", descriptor.key(), e.getMessage());
            throw new WorkflowTaskError(InvalidInputException.ERROR_CODE,
                    "Command " + descriptor.key() + " could not be constructed from process variables", e);
        }
    }

    private List<String> parameterNames(TaskExecution execution) {
        Object raw = execution.getVariable(CONSTRUCTOR_PARAMETERS);
        if (raw == null) {
            throw new WorkflowTaskError(MISSING_VARIABLE, "Missing process variable: " + CONSTRUCTOR_PARAMETERS);
        }
        if (!(raw instanceof Collection<?> collection)) {
            throw new WorkflowTaskError(PARAMETER_MISMATCH, CONSTRUCTOR_PARAMETERS + " must be a list of names");
        }
        List<String> names = new ArrayList<>(collection.size());
        for (Object name : collection) {
            if (!(name instanceof String s) || s.isBlank()) {
                throw new WorkflowTaskError(PARAMETER_MISMATCH, CONSTRUCTOR_PARAMETERS + " must be a list of names");
            }
            names.add(s);
        }
        return names;
    }

    /**
     * Compares the tenant variable with the engine's tenant of the running instance.
     * A missing engine tenant fails closed.
     */
    private void verifyTenant(TaskExecution execution) {
        Object variable = execution.getVariable(CommandRegistry.TENANT_PARAMETER);
        String variableTenant = variable instanceof TenantId tenantId ? tenantId.value()
                : variable instanceof String s ? s : null;
        Optional<String> engineTenant = execution.getTenantId();

        if (variableTenant == null || engineTenant.isEmpty() || !engineTenant.get().equals(variableTenant)) {
            log.warn("Tenant isolation violation in dispatch task: processInstanceId={}, activityId={}",
                    execution.getProcessInstanceId(), execution.getActivityId());
            log.debug("Dispatch tenant mismatch: engineTenant={}, variableTenant={}",
                    engineTenant.orElse(null), variableTenant);
            if (metrics != null) {
                metrics.recordTenantIsolationViolation("dispatch");
            }
            throw new WorkflowTaskError(TENANT_ISOLATION_VIOLATION, "Access denied");
        }
    }

    private Object convert(CommandParameter parameter, Object value) {
        if (parameter.type().isInstance(value)) {
            return value;
        }
        try {
            return objectMapper.convertValue(value, objectMapper.constructType(parameter.genericType()));
        } catch (IllegalArgumentException e) {
            throw new WorkflowTaskError(PARAMETER_TYPE_MISMATCH, "Variable '" + parameter.name()
                    + "' cannot be converted to " + parameter.type().getSimpleName(), e);
        }
    }

    // ==================== Dispatch ====================

    private Mono<CommandResult> withTimeLimit(String commandKey, Mono<CommandResult> dispatch) {
        if (timeLimiter == null) {
            return dispatch;
        }
        Duration timeout = timeLimiter.getTimeLimiterConfig().getTimeoutDuration();
        return dispatch
                .timeout(timeout)
                .doOnError(TimeoutException.class, e -> {
                    timeLimiter.onError(e);
                    log.warn("TIME_LIMITER_TIMEOUT: command={}, timeout={}", commandKey, timeout);
                })
                .doOnSuccess(result -> timeLimiter.onSuccess());
    }

    private WorkflowTaskError toTaskError(String commandKey, Throwable error) {
        if (error instanceof WorkflowTaskError taskError) {
            return taskError;
        }
        if (error instanceof TimeoutException) {
            return new WorkflowTaskError(DISPATCH_TIMEOUT, "Command " + commandKey + " timed out", error);
        }
        if (error instanceof EventBridgeException bridgeException
                && DOMAIN_CODES.contains(bridgeException.getErrorCode())) {
            return new WorkflowTaskError(bridgeException.getErrorCode(), bridgeException.getMessage(), error);
        }
        log.error("Workflow command {} failed unexpectedly", commandKey, error);
        return new WorkflowTaskError(COMMAND_DISPATCH_FAILED, "Command " + commandKey + " failed", error);
    }

    private Mono<Void> fail(TaskExecution execution, String commandKey, WorkflowTaskError error, long startNanos) {
        execution.setVariable(COMMAND_RESULT, error.getErrorCode());
        recordOutcome(commandKey, error.getErrorCode(), startNanos);
        log.info("Workflow command {} failed with {}: processInstanceId={}, activityId={}",
                commandKey, error.getErrorCode(), execution.getProcessInstanceId(), execution.getActivityId());
        return Mono.error(error);
    }

    private void recordOutcome(String commandKey, String outcome, long startNanos) {
        if (metrics != null) {
            metrics.recordCommandDispatch(commandKey, outcome, Duration.ofNanos(System.nanoTime() - startNanos));
        }
    }
}
