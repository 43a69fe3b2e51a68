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

package org.fireflyframework.eventbridge.bridge.compensation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.eventbridge.bridge.dispatch.CommandDispatchTask;
import org.fireflyframework.eventbridge.bridge.engine.inmemory.ErrorBoundary;
import org.fireflyframework.eventbridge.bridge.engine.inmemory.ProcessNode;
import org.fireflyframework.eventbridge.bridge.engine.inmemory.ProcessNode.ServiceTaskNode;
import org.fireflyframework.eventbridge.bridge.engine.inmemory.ProcessNode.SetVariablesNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds error boundaries that compensate a failed dispatch.
 * <p>
 * The boundary path rewrites {@code commandClassName} and {@code constructorParameters}
 * to point at the inverse command and then runs the same {@link CommandDispatchTask}.
 * The dispatch task does not know it is compensating; only the variables differ. Values
 * the inverse command needs beyond the ones already in the process (a cancellation
 * reason, for example) are passed as extra variables.
 * <p>
 * Example:
 * <pre>{@code
 * ProcessDefinition.builder("provisioning")
 *     .serviceTask("start", dispatchTask,
 *         overlay.onAnyError("request.provisioning.fail",
 *             List.of("tenantId", "requestId", "errorCode", "errorMessage"), Map.of()))
 *     .build();
 * }</pre>
 */
@Slf4j
@RequiredArgsConstructor
public class CompensationOverlay {

    private final CommandDispatchTask dispatchTask;

    /**
     * Boundary catching one error code.
     */
    public ErrorBoundary onError(String errorCode, String commandKey, List<String> parameters,
                                 Map<String, Object> extraVariables) {
        return new ErrorBoundary(errorCode, compensateWith(commandKey, parameters, extraVariables));
    }

    /**
     * Boundary catching every error code not caught by a more specific boundary.
     */
    public ErrorBoundary onAnyError(String commandKey, List<String> parameters, Map<String, Object> extraVariables) {
        return new ErrorBoundary(null, compensateWith(commandKey, parameters, extraVariables));
    }

    /**
     * The compensation path: rewrite the dispatch variables, then dispatch.
     */
    public List<ProcessNode> compensateWith(String commandKey, List<String> parameters,
                                            Map<String, Object> extraVariables) {
        Map<String, Object> variables = new LinkedHashMap<>(extraVariables);
        variables.put(CommandDispatchTask.COMMAND_CLASS_NAME, commandKey);
        variables.put(CommandDispatchTask.CONSTRUCTOR_PARAMETERS, List.copyOf(parameters));

        log.debug("Compensation path configured: command={}, parameters={}", commandKey, parameters);
        return List.of(
                new SetVariablesNode("compensate-" + commandKey + "-variables", variables),
                new ServiceTaskNode("compensate-" + commandKey, dispatchTask, List.of()));
    }
}
