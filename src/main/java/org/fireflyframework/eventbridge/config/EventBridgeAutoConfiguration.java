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

package org.fireflyframework.eventbridge.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.r2dbc.spi.ConnectionFactory;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.eventbridge.bridge.compensation.CompensationOverlay;
import org.fireflyframework.eventbridge.bridge.dispatch.CommandDispatchTask;
import org.fireflyframework.eventbridge.bridge.dispatch.CommandRegistry;
import org.fireflyframework.eventbridge.bridge.engine.WorkflowRuntime;
import org.fireflyframework.eventbridge.bridge.engine.inmemory.InMemoryWorkflowRuntime;
import org.fireflyframework.eventbridge.bridge.signal.EventSignalBridge;
import org.fireflyframework.eventbridge.command.CommandGateway;
import org.fireflyframework.eventbridge.command.CommandHandlerRegistrar;
import org.fireflyframework.eventbridge.command.DefaultCommandGateway;
import org.fireflyframework.eventbridge.event.CorrelationContextResolver;
import org.fireflyframework.eventbridge.event.DomainEventBus;
import org.fireflyframework.eventbridge.event.DomainEventPublisher;
import org.fireflyframework.eventbridge.event.SynchronousDomainEventBus;
import org.fireflyframework.eventbridge.eventsourcing.serialization.EventSerializer;
import org.fireflyframework.eventbridge.eventsourcing.serialization.EventTypeRegistry;
import org.fireflyframework.eventbridge.eventsourcing.snapshot.AggregateSnapshotter;
import org.fireflyframework.eventbridge.eventsourcing.snapshot.InMemorySnapshotStore;
import org.fireflyframework.eventbridge.eventsourcing.snapshot.R2dbcSnapshotStore;
import org.fireflyframework.eventbridge.eventsourcing.snapshot.SnapshotStore;
import org.fireflyframework.eventbridge.eventsourcing.store.EventSourcedRepository;
import org.fireflyframework.eventbridge.eventsourcing.store.EventStore;
import org.fireflyframework.eventbridge.eventsourcing.store.EventStoreMigrator;
import org.fireflyframework.eventbridge.eventsourcing.store.InMemoryEventStore;
import org.fireflyframework.eventbridge.eventsourcing.store.R2dbcEventStore;
import org.fireflyframework.eventbridge.health.EventStoreHealthIndicator;
import org.fireflyframework.eventbridge.metrics.BridgeMetrics;
import org.fireflyframework.eventbridge.projection.ProjectionUpdater;
import org.fireflyframework.eventbridge.properties.EventBridgeProperties;
import org.fireflyframework.eventbridge.properties.EventBridgeProperties.EventStoreType;
import org.fireflyframework.eventbridge.request.ResourceRequestAggregate;
import org.fireflyframework.eventbridge.request.ResourceRequestState;
import org.fireflyframework.eventbridge.request.handler.ResourceRequestCommandHandlers;
import org.fireflyframework.eventbridge.tracing.BridgeTracer;
import org.fireflyframework.eventbridge.tracing.EventBridgeTracingAutoConfiguration;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.Nullable;
import org.springframework.r2dbc.connection.R2dbcTransactionManager;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.transaction.reactive.TransactionalOperator;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * Auto-configuration for the Firefly Event Bridge.
 * <p>
 * This configuration provides:
 * <ul>
 *   <li>EventStore - in-memory or R2DBC, selected by {@code firefly.eventbridge.event-store.type}</li>
 *   <li>EventStoreMigrator - Flyway migration of the R2DBC schema before the store is used</li>
 *   <li>SnapshotStore - latest aggregate snapshots, shortening replay on load</li>
 *   <li>DomainEventBus and DomainEventPublisher - publish committed events with correlation metadata</li>
 *   <li>EventSourcedRepository and command handlers for the resource request aggregate</li>
 *   <li>CommandGateway and CommandRegistry - route commands built by workflow tasks</li>
 *   <li>CommandDispatchTask and CompensationOverlay - the workflow-facing dispatch task</li>
 *   <li>EventSignalBridge - resumes waiting workflow instances</li>
 *   <li>EventStoreHealthIndicator - health monitoring</li>
 * </ul>
 * A {@link WorkflowRuntime} bean defined by the application replaces the in-memory runtime.
 */
@Slf4j
@AutoConfiguration(
        after = EventBridgeTracingAutoConfiguration.class,
        afterName = {
                "org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration",
                "org.springframework.boot.autoconfigure.r2dbc.R2dbcAutoConfiguration",
                "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration"
        })
@EnableConfigurationProperties(EventBridgeProperties.class)
@ConditionalOnProperty(prefix = "firefly.eventbridge", name = "enabled", havingValue = "true", matchIfMissing = true)
public class EventBridgeAutoConfiguration {

    // ==================== Event Store Beans ====================

    @Bean
    @ConditionalOnMissingBean
    public EventTypeRegistry eventTypeRegistry() {
        log.info("Creating EventTypeRegistry with {} resource request event types",
                ResourceRequestAggregate.EVENT_TYPES.size());
        return new EventTypeRegistry().registerAll(ResourceRequestAggregate.EVENT_TYPES);
    }

    @Bean
    @ConditionalOnMissingBean
    public EventSerializer eventSerializer(EventTypeRegistry eventTypeRegistry,
                                           ObjectProvider<ObjectMapper> objectMapper) {
        log.info("Creating EventSerializer");
        return new EventSerializer(eventTypeRegistry, objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public EventStore eventStore(EventBridgeProperties properties,
                                 EventSerializer eventSerializer,
                                 ObjectProvider<ConnectionFactory> connectionFactory,
                                 ObjectProvider<EventStoreMigrator> eventStoreMigrator) {
        EventStoreType type = properties.getEventStore().getType();
        if (type == EventStoreType.R2DBC) {
            ConnectionFactory factory = requireConnectionFactory(connectionFactory);
            eventStoreMigrator.ifAvailable(EventStoreMigrator::migrate);
            log.info("Creating R2dbcEventStore");
            return new R2dbcEventStore(DatabaseClient.create(factory),
                    TransactionalOperator.create(new R2dbcTransactionManager(factory)),
                    eventSerializer);
        }
        log.info("Creating InMemoryEventStore");
        return new InMemoryEventStore(eventSerializer);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "firefly.eventbridge.snapshots", name = "enabled", havingValue = "true", matchIfMissing = true)
    public SnapshotStore snapshotStore(EventBridgeProperties properties,
                                       ObjectProvider<ConnectionFactory> connectionFactory) {
        if (properties.getEventStore().getType() == EventStoreType.R2DBC) {
            ConnectionFactory factory = requireConnectionFactory(connectionFactory);
            log.info("Creating R2dbcSnapshotStore");
            return new R2dbcSnapshotStore(DatabaseClient.create(factory),
                    TransactionalOperator.create(new R2dbcTransactionManager(factory)));
        }
        log.info("Creating InMemorySnapshotStore");
        return new InMemorySnapshotStore();
    }

    private static ConnectionFactory requireConnectionFactory(ObjectProvider<ConnectionFactory> connectionFactory) {
        ConnectionFactory factory = connectionFactory.getIfAvailable();
        if (factory == null) {
            throw new IllegalStateException(
                    "firefly.eventbridge.event-store.type=r2dbc requires a ConnectionFactory bean");
        }
        return factory;
    }

    // ==================== Event Publishing Beans ====================

    @Bean
    @ConditionalOnMissingBean
    public DomainEventBus domainEventBus() {
        log.info("Creating SynchronousDomainEventBus");
        return new SynchronousDomainEventBus();
    }

    @Bean
    @ConditionalOnMissingBean
    public CorrelationContextResolver correlationContextResolver(EventBridgeProperties properties) {
        log.info("Creating CorrelationContextResolver with {} message name mappings",
                properties.getSignals().getMessageNames().size());
        return new CorrelationContextResolver(properties.getSignals().getMessageNames());
    }

    @Bean
    @ConditionalOnMissingBean
    public DomainEventPublisher domainEventPublisher(DomainEventBus domainEventBus,
                                                     CorrelationContextResolver correlationContextResolver) {
        log.info("Creating DomainEventPublisher");
        return new DomainEventPublisher(domainEventBus, correlationContextResolver);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnProperty(prefix = "firefly.eventbridge", name = "metrics-enabled", havingValue = "true", matchIfMissing = true)
    public BridgeMetrics bridgeMetrics(MeterRegistry meterRegistry) {
        log.info("Creating BridgeMetrics");
        return new BridgeMetrics(meterRegistry);
    }

    // ==================== Command Beans ====================

    @Bean
    @ConditionalOnMissingBean
    public EventSourcedRepository<ResourceRequestAggregate> resourceRequestRepository(
            EventStore eventStore,
            EventSerializer eventSerializer,
            DomainEventPublisher domainEventPublisher,
            ObjectProvider<ProjectionUpdater> projectionUpdaters,
            ObjectProvider<SnapshotStore> snapshotStore,
            EventBridgeProperties properties,
            @Nullable BridgeMetrics bridgeMetrics) {
        List<ProjectionUpdater> updaters = projectionUpdaters.orderedStream().toList();
        SnapshotStore snapshots = snapshotStore.getIfAvailable();
        AggregateSnapshotter<ResourceRequestAggregate> snapshotter = snapshots == null ? null
                : AggregateSnapshotter.of(snapshots, eventSerializer, ResourceRequestState.class,
                        id -> ResourceRequestAggregate.reconstitute(id, List.of()),
                        properties.getSnapshots().getThreshold());
        log.info("Creating EventSourcedRepository for {} with {} projection updaters, snapshot threshold: {}",
                ResourceRequestAggregate.AGGREGATE_TYPE, updaters.size(),
                snapshotter == null ? "disabled" : snapshotter.getThreshold());
        return new EventSourcedRepository<>(eventStore, eventSerializer, ResourceRequestAggregate.AGGREGATE_TYPE,
                ResourceRequestAggregate::reconstitute, domainEventPublisher, updaters, bridgeMetrics, snapshotter);
    }

    @Bean
    @ConditionalOnMissingBean
    public ResourceRequestCommandHandlers resourceRequestCommandHandlers(
            EventSourcedRepository<ResourceRequestAggregate> resourceRequestRepository) {
        log.info("Creating ResourceRequestCommandHandlers");
        return new ResourceRequestCommandHandlers(resourceRequestRepository);
    }

    @Bean
    @ConditionalOnMissingBean(CommandGateway.class)
    public DefaultCommandGateway commandGateway(ObjectProvider<CommandHandlerRegistrar> registrars) {
        log.info("Creating DefaultCommandGateway");
        return new DefaultCommandGateway(registrars.orderedStream().toList());
    }

    @Bean
    @ConditionalOnMissingBean
    public CommandRegistry commandRegistry(CommandGateway commandGateway) {
        if (commandGateway instanceof DefaultCommandGateway defaultGateway) {
            log.info("Creating CommandRegistry from {} handled command types",
                    defaultGateway.getRegisteredCommandTypes().size());
            return new CommandRegistry(defaultGateway.getRegisteredCommandTypes());
        }
        log.warn("Creating empty CommandRegistry: custom CommandGateway {} does not expose its command types",
                commandGateway.getClass().getSimpleName());
        return new CommandRegistry();
    }

    // ==================== Workflow Bridge Beans ====================

    @Bean
    @ConditionalOnMissingBean
    public WorkflowRuntime workflowRuntime() {
        log.info("Creating InMemoryWorkflowRuntime");
        return new InMemoryWorkflowRuntime();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "firefly.eventbridge.dispatch", name = "enabled", havingValue = "true", matchIfMissing = true)
    public CommandDispatchTask commandDispatchTask(CommandRegistry commandRegistry,
                                                   CommandGateway commandGateway,
                                                   ObjectProvider<ObjectMapper> objectMapper,
                                                   EventBridgeProperties properties,
                                                   @Nullable BridgeMetrics bridgeMetrics,
                                                   @Nullable BridgeTracer bridgeTracer) {
        TimeLimiter timeLimiter = TimeLimiter.of("eventbridge-dispatch", TimeLimiterConfig.custom()
                .timeoutDuration(properties.getDispatch().getTimeout())
                .build());
        timeLimiter.getEventPublisher()
                .onError(event -> log.warn("TIME_LIMITER_ERROR: name={}, error={}",
                        event.getTimeLimiterName(), event.getThrowable().getMessage()));

        ObjectMapper mapper = objectMapper.getIfAvailable(() -> new ObjectMapper().registerModule(new JavaTimeModule()));
        log.info("Creating CommandDispatchTask with timeout: {}, metrics: {}, tracing: {}",
                properties.getDispatch().getTimeout(), bridgeMetrics != null, bridgeTracer != null);
        return new CommandDispatchTask(commandRegistry, commandGateway, mapper, timeLimiter, bridgeMetrics, bridgeTracer);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(CommandDispatchTask.class)
    public CompensationOverlay compensationOverlay(CommandDispatchTask commandDispatchTask) {
        log.info("Creating CompensationOverlay");
        return new CompensationOverlay(commandDispatchTask);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "firefly.eventbridge.signals", name = "enabled", havingValue = "true", matchIfMissing = true)
    public EventSignalBridge eventSignalBridge(WorkflowRuntime workflowRuntime,
                                               DomainEventBus domainEventBus,
                                               @Nullable BridgeMetrics bridgeMetrics,
                                               @Nullable BridgeTracer bridgeTracer) {
        log.info("Creating EventSignalBridge on {}", workflowRuntime.getClass().getSimpleName());
        EventSignalBridge bridge = new EventSignalBridge(workflowRuntime, bridgeMetrics, bridgeTracer);
        domainEventBus.subscribe(bridge);
        return bridge;
    }

    // ==================== Health Beans ====================

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "firefly.eventbridge", name = "health-enabled", havingValue = "true", matchIfMissing = true)
    public EventStoreHealthIndicator eventStoreHealthIndicator(EventStore eventStore, CommandRegistry commandRegistry) {
        log.info("Creating EventStoreHealthIndicator");
        return new EventStoreHealthIndicator(eventStore, commandRegistry);
    }

    // ==================== Schema Migration ====================

    /**
     * Flyway migration of the R2DBC event store schema.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "org.flywaydb.core.Flyway")
    @ConditionalOnProperty(prefix = "firefly.eventbridge.event-store", name = "type", havingValue = "r2dbc")
    static class EventStoreMigrationConfiguration {

        @Bean
        @ConditionalOnMissingBean
        @ConditionalOnProperty(prefix = "firefly.eventbridge.event-store.migration", name = "enabled", havingValue = "true", matchIfMissing = true)
        public EventStoreMigrator eventStoreMigrator(EventBridgeProperties properties) {
            EventBridgeProperties.MigrationConfig migration = properties.getEventStore().getMigration();
            if (!StringUtils.hasText(migration.getUrl())) {
                throw new IllegalStateException(
                        "firefly.eventbridge.event-store.migration.url is required to migrate the R2DBC event store");
            }
            log.info("Creating EventStoreMigrator for {}", migration.getUrl());
            return new EventStoreMigrator(migration.getUrl(), migration.getUsername(), migration.getPassword());
        }
    }
}
