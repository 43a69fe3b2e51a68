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

package org.fireflyframework.eventbridge.bridge.signal;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.eventbridge.bridge.engine.ProcessInstance;
import org.fireflyframework.eventbridge.bridge.engine.WorkflowEngineException;
import org.fireflyframework.eventbridge.bridge.engine.WorkflowRuntime;
import org.fireflyframework.eventbridge.bridge.signal.SignalOutcome.Status;
import org.fireflyframework.eventbridge.event.CorrelationContext;
import org.fireflyframework.eventbridge.event.DomainEventSubscriber;
import org.fireflyframework.eventbridge.event.EventEnvelope;
import org.fireflyframework.eventbridge.eventsourcing.domain.StoredEvent;
import org.fireflyframework.eventbridge.metrics.BridgeMetrics;
import org.fireflyframework.eventbridge.tenant.TenantId;
import org.fireflyframework.eventbridge.tracing.BridgeTracer;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * Resumes workflow instances waiting for a domain event.
 * <p>
 * For each published event the bridge reads the {@link CorrelationContext}, finds the
 * instance subscribed to the message with the correlation key as business key, and
 * delivers the message if the instance's {@value #TENANT_VARIABLE} variable equals the
 * event's tenant. A tenant mismatch drops the signal and leaves the instance waiting.
 * <p>
 * Missing routing metadata and missing instances are normal and never fail the
 * publisher; neither do delivery errors, which are logged and counted.
 */
@Slf4j
public class EventSignalBridge implements DomainEventSubscriber {

    public static final String TENANT_VARIABLE = "tenantId";

    public static final String SIGNAL_EVENT_TYPE = "signalEventType";
    public static final String SIGNAL_AGGREGATE_ID = "signalAggregateId";
    public static final String SIGNAL_AGGREGATE_VERSION = "signalAggregateVersion";

    private final WorkflowRuntime workflowRuntime;
    private final BridgeMetrics metrics;
    private final BridgeTracer tracer;

    public EventSignalBridge(WorkflowRuntime workflowRuntime,
                             @Nullable BridgeMetrics metrics,
                             @Nullable BridgeTracer tracer) {
        this.workflowRuntime = workflowRuntime;
        this.metrics = metrics;
        this.tracer = tracer;
    }

    @Override
    public Mono<Void> onEvent(EventEnvelope envelope) {
        return handle(envelope).then();
    }

    /**
     * Routes one event and reports what happened.
     */
    public Mono<SignalOutcome> handle(EventEnvelope envelope) {
        CorrelationContext correlation = envelope.correlation();
        StoredEvent storedEvent = envelope.storedEvent();

        if (correlation == null || !correlation.isRoutable()) {
            log.debug("Event not routed to a workflow: type={}, aggregateId={}",
                    storedEvent.eventType(), storedEvent.aggregateId());
            return Mono.just(SignalOutcome.of(Status.SKIPPED));
        }

        Mono<SignalOutcome> routing = workflowRuntime
                .findWaitingInstance(correlation.messageName(), correlation.correlationKey(), correlation.tenantId())
                .flatMap(instance -> deliver(instance, correlation, storedEvent))
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    log.warn("No workflow instance waiting for message '{}' with correlation key {}",
                            correlation.messageName(), correlation.correlationKey());
                    record(correlation.messageName(), Status.NO_WAITING_INSTANCE);
                    return SignalOutcome.of(Status.NO_WAITING_INSTANCE);
                }));

        return tracer != null
                ? tracer.traceSignal(correlation.messageName(), correlation.correlationKey(), routing)
                : routing;
    }

    private Mono<SignalOutcome> deliver(ProcessInstance instance, CorrelationContext correlation,
                                        StoredEvent storedEvent) {
        if (!tenantMatches(instance, correlation.tenantId())) {
            log.warn("Signal dropped: tenant mismatch for message '{}' on process instance {}",
                    correlation.messageName(), instance.id());
            if (metrics != null) {
                metrics.recordTenantIsolationViolation("signal");
            }
            record(correlation.messageName(), Status.TENANT_MISMATCH);
            return Mono.just(SignalOutcome.of(Status.TENANT_MISMATCH, instance.id()));
        }

        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put(SIGNAL_EVENT_TYPE, storedEvent.eventType());
        variables.put(SIGNAL_AGGREGATE_ID, storedEvent.aggregateId().toString());
        variables.put(SIGNAL_AGGREGATE_VERSION, storedEvent.version());

        return workflowRuntime.deliverMessage(instance.id(), correlation.messageName(), variables)
                .then(Mono.fromSupplier(() -> {
                    log.info("Delivered message '{}' to process instance {} (event {} v{})",
                            correlation.messageName(), instance.id(), storedEvent.eventType(), storedEvent.version());
                    record(correlation.messageName(), Status.DELIVERED);
                    return SignalOutcome.of(Status.DELIVERED, instance.id());
                }))
                .onErrorResume(error -> !(error instanceof CancellationException), error -> {
                    if (error instanceof WorkflowEngineException) {
                        log.warn("Message '{}' not delivered to process instance {}: {}",
                                correlation.messageName(), instance.id(), error.getMessage());
                    } else {
                        log.error("Failed to deliver message '{}' to process instance {}",
                                correlation.messageName(), instance.id(), error);
                    }
                    record(correlation.messageName(), Status.DELIVERY_FAILED);
                    return Mono.just(SignalOutcome.of(Status.DELIVERY_FAILED, instance.id()));
                });
    }

    /**
     * The instance's tenant variable must be present and equal to the event tenant. When
     * the engine also knows the instance tenant, that must match too.
     */
    private boolean tenantMatches(ProcessInstance instance, String eventTenant) {
        if (eventTenant == null) {
            log.debug("Event without tenant cannot signal process instance {}", instance.id());
            return false;
        }
        Object variable = instance.getVariable(TENANT_VARIABLE);
        String instanceTenant = variable instanceof TenantId tenantId ? tenantId.value()
                : variable instanceof String s ? s : null;
        if (instanceTenant == null) {
            log.debug("Process instance {} has no usable '{}' variable", instance.id(), TENANT_VARIABLE);
            return false;
        }
        if (instance.tenantId() != null && !instance.tenantId().equals(eventTenant)) {
            log.debug("Engine tenant of process instance {} differs from event tenant", instance.id());
            return false;
        }
        boolean matches = instanceTenant.equals(eventTenant);
        if (!matches) {
            log.debug("Tenant variable of process instance {} is {}, event tenant is {}",
                    instance.id(), instanceTenant, eventTenant);
        }
        return matches;
    }

    private void record(String messageName, Status status) {
        if (metrics != null) {
            metrics.recordSignalDelivery(messageName, status.name());
        }
    }
}
