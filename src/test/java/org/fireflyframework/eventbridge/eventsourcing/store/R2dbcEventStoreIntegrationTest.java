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

package org.fireflyframework.eventbridge.eventsourcing.store;

import io.r2dbc.spi.ConnectionFactories;
import io.r2dbc.spi.ConnectionFactory;
import io.r2dbc.spi.ConnectionFactoryOptions;
import org.fireflyframework.eventbridge.eventsourcing.domain.AbstractDomainEvent;
import org.fireflyframework.eventbridge.exception.ConcurrencyConflictException;
import org.fireflyframework.eventbridge.exception.TenantIsolationException;
import org.fireflyframework.eventbridge.request.ResourceRequestAggregate;
import org.fireflyframework.eventbridge.request.event.RequestApprovedEvent;
import org.fireflyframework.eventbridge.tenant.TenantId;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.r2dbc.connection.R2dbcTransactionManager;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.transaction.reactive.TransactionalOperator;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.containers.PostgreSQLR2DBCDatabaseContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.fireflyframework.eventbridge.support.EventBridgeTestFixtures.*;

/**
 * Integration tests for {@link R2dbcEventStore} against a real PostgreSQL instance.
 * <p>
 * The schema is applied through {@link EventStoreMigrator}. The store connects as a
 * plain login role, because superusers bypass row level security.
 */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("R2DBC Event Store Integration Tests")
class R2dbcEventStoreIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>(DockerImageName.parse("postgres:15-alpine"))
            .withDatabaseName("eventbridge")
            .withUsername("test")
            .withPassword("test");

    static final String APP_ROLE = "eventbridge_app";
    static final String APP_PASSWORD = "app";

    private static int migrationsApplied;
    private static ConnectionFactory adminConnectionFactory;
    private static ConnectionFactory appConnectionFactory;

    private R2dbcEventStore eventStore;
    private DatabaseClient appClient;
    private DatabaseClient adminClient;
    private UUID aggregateId;

    @BeforeAll
    static void migrateSchema() {
        migrationsApplied = new EventStoreMigrator(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword())
                .migrate();

        ConnectionFactoryOptions adminOptions = PostgreSQLR2DBCDatabaseContainer.getOptions(postgres);
        adminConnectionFactory = ConnectionFactories.get(adminOptions);
        DatabaseClient admin = DatabaseClient.create(adminConnectionFactory);
        Flux.just(
                        "CREATE ROLE " + APP_ROLE + " LOGIN PASSWORD '" + APP_PASSWORD + "'",
                        "GRANT SELECT, INSERT ON domain_events TO " + APP_ROLE,
                        "GRANT SELECT, INSERT, UPDATE ON aggregate_snapshots TO " + APP_ROLE)
                .concatMap(statement -> admin.sql(statement).then())
                .blockLast();

        appConnectionFactory = ConnectionFactories.get(ConnectionFactoryOptions.builder()
                .from(adminOptions)
                .option(ConnectionFactoryOptions.USER, APP_ROLE)
                .option(ConnectionFactoryOptions.PASSWORD, APP_PASSWORD)
                .build());
    }

    @BeforeEach
    void setUp() {
        appClient = DatabaseClient.create(appConnectionFactory);
        adminClient = DatabaseClient.create(adminConnectionFactory);
        TransactionalOperator transactionalOperator =
                TransactionalOperator.create(new R2dbcTransactionManager(appConnectionFactory));
        eventStore = new R2dbcEventStore(appClient, transactionalOperator, serializer());
        aggregateId = UUID.randomUUID();
    }

    private List<AbstractDomainEvent> createdEvents() {
        return pendingRequest(aggregateId, TENANT_A).getUncommittedEvents();
    }

    private Mono<Boolean> tryAppendCreated(List<AbstractDomainEvent> events) {
        return eventStore.appendEvents(TENANT_A, aggregateId, ResourceRequestAggregate.AGGREGATE_TYPE, events, 0)
                .map(stream -> true)
                .onErrorResume(ConcurrencyConflictException.class, e -> Mono.just(false));
    }

    @Test
    @DisplayName("should append and reload a stream with its metadata")
    void shouldAppendAndLoad() {
        AbstractDomainEvent approved = RequestApprovedEvent.builder()
                .aggregateId(aggregateId)
                .metadata(metadata(TENANT_A, ADMIN))
                .approvedBy(ADMIN)
                .build();

        StepVerifier.create(eventStore.appendEvents(TENANT_A, aggregateId,
                                ResourceRequestAggregate.AGGREGATE_TYPE, createdEvents(), 0)
                        .then(eventStore.appendEvents(TENANT_A, aggregateId,
                                ResourceRequestAggregate.AGGREGATE_TYPE, List.of(approved), 1))
                        .then(eventStore.loadEventStream(TENANT_A, aggregateId)))
                .assertNext(stream -> {
                    assertThat(stream.getVersion()).isEqualTo(2);
                    assertThat(stream.events()).extracting("eventType")
                            .containsExactly("request.created", "request.approved");
                    assertThat(stream.events().get(1).metadata().userId()).isEqualTo(ADMIN);

                    ResourceRequestAggregate aggregate = ResourceRequestAggregate.reconstitute(
                            aggregateId, serializer().deserializeAll(stream.events()));
                    assertThat(aggregate.getState().decidedBy()).isEqualTo(ADMIN);
                    assertThat(aggregate.getCurrentVersion()).isEqualTo(2);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("should report a stale expected version as a conflict")
    void shouldDetectConflict() {
        StepVerifier.create(tryAppendCreated(createdEvents())
                        .then(eventStore.appendEvents(TENANT_A, aggregateId,
                                ResourceRequestAggregate.AGGREGATE_TYPE, createdEvents(), 0)))
                .expectError(ConcurrencyConflictException.class)
                .verify();
    }

    @Test
    @DisplayName("should let exactly one concurrent writer win")
    void shouldArbitrateConcurrentWriters() {
        List<AbstractDomainEvent> created = createdEvents();

        StepVerifier.create(Flux.range(0, 4)
                        .flatMap(i -> tryAppendCreated(created))
                        .collectList())
                .assertNext(results -> assertThat(results).containsOnlyOnce(true))
                .verifyComplete();

        StepVerifier.create(eventStore.getAggregateVersion(TENANT_A, aggregateId))
                .expectNext(1L)
                .verifyComplete();
    }

    @Test
    @DisplayName("should isolate streams by tenant")
    void shouldIsolateTenants() {
        StepVerifier.create(tryAppendCreated(createdEvents())
                        .then(eventStore.loadEventStream(TENANT_B, aggregateId)))
                .assertNext(stream -> assertThat(stream.isEmpty()).isTrue())
                .verifyComplete();

        StepVerifier.create(eventStore.appendEvents(TENANT_B, aggregateId,
                        ResourceRequestAggregate.AGGREGATE_TYPE, createdEvents(), 1))
                .expectError(TenantIsolationException.class)
                .verify();
    }

    @Test
    @DisplayName("should report healthy while the database is reachable")
    void shouldBeHealthy() {
        StepVerifier.create(eventStore.isHealthy())
                .expectNext(true)
                .verifyComplete();
    }

    @Test
    @DisplayName("should keep tenants apart while both append in parallel")
    void shouldIsolateTenantsUnderParallelAppends() {
        List<UUID> ids = Flux.range(0, 40).map(i -> UUID.randomUUID()).collectList().block();

        Flux<UUID> appends = Flux.fromIterable(ids)
                .index()
                .flatMap(indexed -> {
                    TenantId owner = indexed.getT1() % 2 == 0 ? TENANT_A : TENANT_B;
                    UUID id = indexed.getT2();
                    return eventStore.appendEvents(owner, id, ResourceRequestAggregate.AGGREGATE_TYPE,
                                    pendingRequest(id, owner).getUncommittedEvents(), 0)
                            .subscribeOn(Schedulers.parallel())
                            .thenReturn(id);
                });
        StepVerifier.create(appends.count())
                .expectNext(40L)
                .verifyComplete();

        Flux<Boolean> crossTenantHits = Flux.fromIterable(ids)
                .index()
                .flatMap(indexed -> {
                    TenantId other = indexed.getT1() % 2 == 0 ? TENANT_B : TENANT_A;
                    return eventStore.loadEventStream(other, indexed.getT2())
                            .subscribeOn(Schedulers.parallel())
                            .map(stream -> !stream.isEmpty());
                });
        StepVerifier.create(crossTenantHits.filter(hit -> hit).count())
                .expectNext(0L)
                .verifyComplete();
    }

    // ========================================================================
    // Schema Migration Tests
    // ========================================================================

    @Nested
    @DisplayName("Schema Migration")
    class SchemaMigrationTests {

        @Test
        @DisplayName("should apply every migration on an empty database")
        void shouldApplyAllMigrations() {
            assertThat(migrationsApplied).isEqualTo(3);

            StepVerifier.create(adminClient.sql("""
                                SELECT COUNT(*) AS applied FROM eventbridge_schema_history WHERE success AND type = 'SQL'
                                """)
                            .map(row -> row.get("applied", Long.class))
                            .one())
                    .expectNext(3L)
                    .verifyComplete();
        }

        @Test
        @DisplayName("should apply nothing when the schema is current")
        void shouldBeIdempotent() {
            int applied = new EventStoreMigrator(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword())
                    .migrate();

            assertThat(applied).isZero();
        }
    }

    // ========================================================================
    // Row Level Security Tests
    // ========================================================================

    @Nested
    @DisplayName("Row Level Security")
    class RowLevelSecurityTests {

        private Mono<Long> countStream(DatabaseClient client) {
            return client.sql("SELECT COUNT(*) AS events FROM domain_events WHERE aggregate_id = :aggregateId")
                    .bind("aggregateId", aggregateId)
                    .map(row -> row.get("events", Long.class))
                    .one();
        }

        private TenantTransactions tenantTransactions() {
            return new TenantTransactions(appClient,
                    TransactionalOperator.create(new R2dbcTransactionManager(appConnectionFactory)));
        }

        @Test
        @DisplayName("should return no rows to a session that never bound a tenant")
        void shouldHideRowsWithoutTenantSetting() {
            StepVerifier.create(tryAppendCreated(createdEvents())
                            .then(countStream(appClient)))
                    .expectNext(0L)
                    .verifyComplete();

            StepVerifier.create(countStream(adminClient))
                    .expectNext(1L)
                    .verifyComplete();
        }

        @Test
        @DisplayName("should scope a query without a tenant predicate to the bound tenant")
        void shouldScopeQueriesToBoundTenant() {
            StepVerifier.create(tryAppendCreated(createdEvents())
                            .then(tenantTransactions().execute(TENANT_B, countStream(appClient))))
                    .expectNext(0L)
                    .verifyComplete();

            StepVerifier.create(tenantTransactions().execute(TENANT_A, countStream(appClient)))
                    .expectNext(1L)
                    .verifyComplete();
        }

        @Test
        @DisplayName("should reject an insert tagged with a tenant other than the bound one")
        void shouldRejectInsertForOtherTenant() {
            Mono<Long> insert = appClient.sql("""
                        INSERT INTO domain_events
                            (id, tenant_id, aggregate_id, aggregate_type, event_type, payload, metadata, version, created_at)
                        VALUES
                            (:id, :tenantId, :aggregateId, 'resource-request', 'request.created',
                             CAST('{}' AS JSONB), CAST('{}' AS JSONB), 1, now())
                        """)
                    .bind("id", UUID.randomUUID())
                    .bind("tenantId", TENANT_A.value())
                    .bind("aggregateId", aggregateId)
                    .fetch()
                    .rowsUpdated();

            StepVerifier.create(tenantTransactions().execute(TENANT_B, insert))
                    .expectErrorSatisfies(error -> assertThat(error).hasStackTraceContaining("row-level security"))
                    .verify();
        }
    }

    // ========================================================================
    // Immutability Tests
    // ========================================================================

    @Nested
    @DisplayName("Append-Only Log")
    class AppendOnlyTests {

        @Test
        @DisplayName("should reject UPDATE of a stored event even for the table owner")
        void shouldRejectUpdate() {
            StepVerifier.create(tryAppendCreated(createdEvents())
                            .then(adminClient.sql("UPDATE domain_events SET event_type = 'tampered' WHERE aggregate_id = :aggregateId")
                                    .bind("aggregateId", aggregateId)
                                    .fetch()
                                    .rowsUpdated()))
                    .expectErrorSatisfies(error -> assertThat(error).hasStackTraceContaining("append-only"))
                    .verify();
        }

        @Test
        @DisplayName("should reject DELETE of a stored event even for the table owner")
        void shouldRejectDelete() {
            StepVerifier.create(tryAppendCreated(createdEvents())
                            .then(adminClient.sql("DELETE FROM domain_events WHERE aggregate_id = :aggregateId")
                                    .bind("aggregateId", aggregateId)
                                    .fetch()
                                    .rowsUpdated()))
                    .expectErrorSatisfies(error -> assertThat(error).hasStackTraceContaining("append-only"))
                    .verify();

            StepVerifier.create(eventStore.getAggregateVersion(TENANT_A, aggregateId))
                    .expectNext(1L)
                    .verifyComplete();
        }

        @Test
        @DisplayName("should deny UPDATE to the application role")
        void shouldDenyUpdateToApplicationRole() {
            StepVerifier.create(tryAppendCreated(createdEvents())
                            .then(appClient.sql("UPDATE domain_events SET event_type = 'tampered' WHERE aggregate_id = :aggregateId")
                                    .bind("aggregateId", aggregateId)
                                    .fetch()
                                    .rowsUpdated()))
                    .expectErrorSatisfies(error -> assertThat(error).hasStackTraceContaining("permission denied"))
                    .verify();
        }
    }
}
