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

package org.fireflyframework.eventbridge.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Micrometer metrics for the event store and the workflow bridges.
 * All metrics are prefixed with {@code firefly.eventbridge.*}.
 */
@Slf4j
public class BridgeMetrics {

    private static final String PREFIX = "firefly.eventbridge.";

    private final MeterRegistry meterRegistry;

    public BridgeMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        log.info("BridgeMetrics initialized");
    }

    // ==================== Event Store Metrics ====================

    public void recordEventsAppended(String aggregateType, int count) {
        counter("events.appended", "aggregate.type", aggregateType).increment(count);

        log.debug("METRIC: events.appended aggregateType={}, count={}", aggregateType, count);
    }

    public void recordConcurrencyConflict(String aggregateType) {
        counter("concurrency.conflicts", "aggregate.type", aggregateType).increment();

        log.debug("METRIC: concurrency.conflict aggregateType={}", aggregateType);
    }

    // ==================== Command Dispatch Metrics ====================

    public void recordCommandDispatch(String commandKey, String outcome, Duration duration) {
        counter("dispatch.commands",
                "command", commandKey,
                "outcome", outcome)
                .increment();

        timer("dispatch.duration",
                "command", commandKey,
                "outcome", outcome)
                .record(duration);

        log.debug("METRIC: dispatch.command command={}, outcome={}, durationMs={}",
                commandKey, outcome, duration.toMillis());
    }

    public void recordCompensationCommand(String commandKey) {
        counter("compensation.commands", "command", commandKey).increment();

        log.debug("METRIC: compensation.command command={}", commandKey);
    }

    // ==================== Signal Metrics ====================

    public void recordSignalDelivery(String messageName, String outcome) {
        counter("signal.deliveries",
                "message", normalizeTag(messageName),
                "outcome", outcome)
                .increment();

        log.debug("METRIC: signal.delivery message={}, outcome={}", messageName, outcome);
    }

    public void recordTenantIsolationViolation(String source) {
        counter("tenant.violations", "source", source).increment();

        log.debug("METRIC: tenant.violation source={}", source);
    }

    // ==================== Helper Methods ====================

    private Counter counter(String name, String... tags) {
        return Counter.builder(PREFIX + name)
                .tags(tags)
                .register(meterRegistry);
    }

    private Timer timer(String name, String... tags) {
        return Timer.builder(PREFIX + name)
                .tags(tags)
                .register(meterRegistry);
    }

    private static String normalizeTag(String value) {
        return value == null || value.isBlank() ? "unknown" : value;
    }
}
