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

package org.fireflyframework.eventbridge.tracing;

import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

/**
 * Wraps bridge operations in Micrometer Observations, which become OpenTelemetry
 * spans when the OTEL bridge is configured.
 * <p>
 * Two span types are produced:
 * <ul>
 *   <li>{@code eventbridge.dispatch} around a command dispatched from a workflow task</li>
 *   <li>{@code eventbridge.signal} around the delivery of a domain event to a waiting instance</li>
 * </ul>
 * Tenant identifiers are never added as key values.
 */
@Slf4j
public class BridgeTracer {

    private static final String DISPATCH_SPAN_NAME = "eventbridge.dispatch";
    private static final String SIGNAL_SPAN_NAME = "eventbridge.signal";

    private final ObservationRegistry observationRegistry;

    public BridgeTracer(@Nullable ObservationRegistry observationRegistry) {
        this.observationRegistry = observationRegistry != null
                ? observationRegistry
                : ObservationRegistry.NOOP;
    }

    /**
     * Traces a command dispatch issued by a workflow service task.
     *
     * @param commandKey        registry key of the command
     * @param processInstanceId the calling process instance
     * @param activityId        the service task node
     * @param execution         the dispatch
     */
    public <T> Mono<T> traceDispatch(String commandKey, String processInstanceId, String activityId,
                                     Mono<T> execution) {
        if (observationRegistry == ObservationRegistry.NOOP) {
            return execution;
        }

        return Mono.defer(() -> {
            Observation observation = Observation.createNotStarted(DISPATCH_SPAN_NAME, observationRegistry)
                    .lowCardinalityKeyValue("command", commandKey)
                    .lowCardinalityKeyValue("activity.id", activityId != null ? activityId : "")
                    .highCardinalityKeyValue("process.instance.id", processInstanceId);

            return observe(observation, execution, "dispatch.outcome");
        });
    }

    /**
     * Traces the delivery of a domain event to a waiting process instance.
     */
    public <T> Mono<T> traceSignal(String messageName, String correlationKey, Mono<T> execution) {
        if (observationRegistry == ObservationRegistry.NOOP) {
            return execution;
        }

        return Mono.defer(() -> {
            Observation observation = Observation.createNotStarted(SIGNAL_SPAN_NAME, observationRegistry)
                    .lowCardinalityKeyValue("message", messageName)
                    .highCardinalityKeyValue("correlation.key", correlationKey);

            return observe(observation, execution, "signal.outcome");
        });
    }

    private <T> Mono<T> observe(Observation observation, Mono<T> execution, String outcomeKey) {
        return execution
                .doOnSubscribe(s -> observation.start())
                .doOnSuccess(result -> {
                    observation.lowCardinalityKeyValue(outcomeKey, "success");
                    observation.stop();
                })
                .doOnError(error -> {
                    observation.lowCardinalityKeyValue(outcomeKey, "error");
                    observation.error(error);
                    observation.stop();
                    log.debug("Trace {} failed: {}", observation.getContext().getName(), error.getMessage());
                })
                .doOnCancel(observation::stop);
    }
}
