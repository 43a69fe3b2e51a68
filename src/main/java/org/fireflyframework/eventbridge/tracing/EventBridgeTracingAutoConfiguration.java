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

import io.micrometer.observation.ObservationRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for bridge tracing using Micrometer Observation.
 * <p>
 * Configuration properties:
 * <pre>
 * firefly:
 *   eventbridge:
 *     tracing:
 *       enabled: true  # Enable/disable tracing (default: true)
 * </pre>
 * Without an {@link ObservationRegistry} bean the tracer is a no-op.
 */
@Slf4j
@AutoConfiguration
@ConditionalOnClass(ObservationRegistry.class)
@ConditionalOnProperty(prefix = "firefly.eventbridge.tracing", name = "enabled", havingValue = "true", matchIfMissing = true)
public class EventBridgeTracingAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public BridgeTracer bridgeTracer(ObjectProvider<ObservationRegistry> observationRegistry) {
        log.info("Configuring BridgeTracer with Micrometer Observation");
        return new BridgeTracer(observationRegistry.getIfAvailable());
    }
}
