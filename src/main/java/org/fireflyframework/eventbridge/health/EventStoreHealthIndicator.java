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

package org.fireflyframework.eventbridge.health;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.eventbridge.bridge.dispatch.CommandRegistry;
import org.fireflyframework.eventbridge.eventsourcing.store.EventStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Health indicator for the event store.
 * <p>
 * Reports:
 * <ul>
 *   <li>Event store connectivity</li>
 *   <li>Number of commands dispatchable from workflows</li>
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public class EventStoreHealthIndicator implements ReactiveHealthIndicator {

    private final EventStore eventStore;
    private final CommandRegistry commandRegistry;

    @Override
    public Mono<Health> health() {
        return eventStore.isHealthy()
                .timeout(Duration.ofSeconds(5))
                .onErrorReturn(false)
                .map(storeHealthy -> {
                    Health.Builder builder = storeHealthy ? Health.up() : Health.down();

                    return builder
                            .withDetail("eventStore", eventStore.getClass().getSimpleName())
                            .withDetail("connection", storeHealthy ? "connected" : "disconnected")
                            .withDetail("workflowCommands", commandRegistry.getKeys().size())
                            .build();
                })
                .onErrorResume(e -> {
                    log.warn("Event store health check failed", e);
                    return Mono.just(Health.down()
                            .withDetail("error", e.getMessage())
                            .build());
                });
    }
}
