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

package org.fireflyframework.eventbridge.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the event bridge library.
 */
@ConfigurationProperties(prefix = "firefly.eventbridge")
@Validated
@Data
public class EventBridgeProperties {

    /**
     * Whether the event bridge is enabled.
     */
    private boolean enabled = true;

    /**
     * Whether to enable metrics collection.
     */
    private boolean metricsEnabled = true;

    /**
     * Whether to register the event store health indicator.
     */
    private boolean healthEnabled = true;

    /**
     * Event store configuration.
     */
    @Valid
    @NotNull
    private EventStoreConfig eventStore = new EventStoreConfig();

    /**
     * Aggregate snapshot configuration.
     */
    @Valid
    @NotNull
    private SnapshotConfig snapshots = new SnapshotConfig();

    /**
     * Command dispatch configuration.
     */
    @Valid
    @NotNull
    private DispatchConfig dispatch = new DispatchConfig();

    /**
     * Event signal configuration.
     */
    @Valid
    @NotNull
    private SignalConfig signals = new SignalConfig();

    /**
     * Event store configuration.
     */
    @Data
    public static class EventStoreConfig {

        /**
         * Storage backend.
         */
        @NotNull
        private EventStoreType type = EventStoreType.IN_MEMORY;

        /**
         * Schema migration of the R2DBC store.
         */
        @Valid
        @NotNull
        private MigrationConfig migration = new MigrationConfig();
    }

    /**
     * Flyway migration of the event store schema. Flyway connects over JDBC, so it
     * needs the JDBC url of the database behind the R2DBC connection factory.
     */
    @Data
    public static class MigrationConfig {

        /**
         * Whether to migrate the schema when the R2DBC store is created.
         */
        private boolean enabled = true;

        /**
         * JDBC url, for example {@code jdbc:postgresql://localhost:5432/eventbridge}.
         */
        private String url;

        private String username;

        private String password;
    }

    /**
     * Aggregate snapshot configuration.
     */
    @Data
    public static class SnapshotConfig {

        /**
         * Whether loads start from the latest snapshot.
         */
        private boolean enabled = true;

        /**
         * Number of events between snapshots of one aggregate.
         */
        @Min(1)
        private int threshold = 50;
    }

    /**
     * Storage backends for domain events.
     */
    public enum EventStoreType {
        /**
         * Process-local maps, for tests and single-node development.
         */
        IN_MEMORY,

        /**
         * PostgreSQL through R2DBC. Requires a {@code ConnectionFactory} bean.
         */
        R2DBC
    }

    /**
     * Configuration of the command dispatch task.
     */
    @Data
    public static class DispatchConfig {

        /**
         * Whether to create the command dispatch task.
         */
        private boolean enabled = true;

        /**
         * Maximum time a dispatched command may take before the task fails with DISPATCH_TIMEOUT.
         */
        @NotNull
        private Duration timeout = Duration.ofSeconds(10);
    }

    /**
     * Configuration of the event signal bridge.
     */
    @Data
    public static class SignalConfig {

        /**
         * Whether committed events are routed to waiting workflow instances.
         */
        private boolean enabled = true;

        /**
         * Event type to message name. Events without an entry are never routed.
         */
        @NotNull
        private Map<String, String> messageNames = new LinkedHashMap<>();
    }
}
