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

import org.fireflyframework.eventbridge.eventsourcing.domain.AbstractDomainEvent;
import org.fireflyframework.eventbridge.eventsourcing.domain.EventStream;
import org.fireflyframework.eventbridge.eventsourcing.domain.StoredEvent;
import org.fireflyframework.eventbridge.eventsourcing.serialization.EventSerializer;
import org.fireflyframework.eventbridge.exception.ConcurrencyConflictException;
import org.fireflyframework.eventbridge.exception.EventStoreException;
import org.fireflyframework.eventbridge.tenant.TenantId;
import io.r2dbc.spi.Readable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * PostgreSQL {@link EventStore} using Spring's reactive {@link DatabaseClient}.
 * <p>
 * Events live in a single {@code domain_events} table shared by all tenants and
 * aggregate types. Every statement carries {@code tenant_id = :tenantId} and runs
 * in a transaction that first binds {@code app.tenant_id}, which the table's row
 * level security policy checks. The unique constraint on
 * {@code (tenant_id, aggregate_id, version)} is the final arbiter of concurrent
 * appends: the loser of a race fails on insert and the violation is reported as a
 * {@link ConcurrencyConflictException}.
 * <p>
 * The schema is applied by {@link EventStoreMigrator} from {@code db/eventbridge}.
 */
@Slf4j
public class R2dbcEventStore implements EventStore {

    private final DatabaseClient databaseClient;
    private final TenantTransactions tenantTransactions;
    private final EventSerializer serializer;
    private final StoredEventFactory storedEventFactory;

    public R2dbcEventStore(DatabaseClient databaseClient,
                           TransactionalOperator transactionalOperator,
                           EventSerializer serializer) {
        this.databaseClient = databaseClient;
        this.tenantTransactions = new TenantTransactions(databaseClient, transactionalOperator);
        this.serializer = serializer;
        this.storedEventFactory = new StoredEventFactory(serializer);
    }

    @Override
    public Mono<EventStream> appendEvents(TenantId tenantId, UUID aggregateId, String aggregateType,
                                          List<? extends AbstractDomainEvent> events, long expectedVersion) {
        return Mono.defer(() -> {
            storedEventFactory.validate(tenantId, aggregateId, events);
            if (events.isEmpty()) {
                return Mono.just(EventStream.empty(aggregateId));
            }

            List<StoredEvent> batch = storedEventFactory.toStoredEvents(aggregateId, aggregateType, events, expectedVersion);
            Mono<EventStream> write = selectVersion(tenantId, aggregateId)
                    .flatMap(actualVersion -> {
                        if (actualVersion != expectedVersion) {
                            return Mono.error(new ConcurrencyConflictException(aggregateId, expectedVersion, actualVersion));
                        }
                        return Flux.fromIterable(batch)
                                .concatMap(event -> insert(tenantId, event))
                                .then(Mono.just(new EventStream(aggregateId, batch)));
                    });

            return inTenantTransaction(tenantId, write)
                    .doOnSuccess(stream -> log.debug("Appended events: tenant={}, aggregateId={}, count={}, newVersion={}",
                            tenantId, aggregateId, batch.size(), stream.getVersion()))
                    .onErrorResume(DataIntegrityViolationException.class, e -> getAggregateVersion(tenantId, aggregateId)
                            .flatMap(actualVersion -> Mono.error(
                                    new ConcurrencyConflictException(aggregateId, expectedVersion, actualVersion))))
                    .onErrorMap(DataAccessException.class, e -> new EventStoreException(
                            "Failed to append events to aggregate " + aggregateId, e));
        });
    }

    @Override
    public Mono<EventStream> loadEventStream(TenantId tenantId, UUID aggregateId) {
        return loadEventStream(tenantId, aggregateId, 1L);
    }

    @Override
    public Mono<EventStream> loadEventStream(TenantId tenantId, UUID aggregateId, long fromVersion) {
        Mono<EventStream> load = databaseClient.sql("""
                    SELECT id, aggregate_id, aggregate_type, event_type, payload, metadata, version, created_at
                    FROM domain_events
                    WHERE tenant_id = :tenantId AND aggregate_id = :aggregateId AND version >= :fromVersion
                    ORDER BY version ASC
                    """)
                .bind("tenantId", tenantId.value())
                .bind("aggregateId", aggregateId)
                .bind("fromVersion", fromVersion)
                .map(this::mapRow)
                .all()
                .collectList()
                .map(events -> new EventStream(aggregateId, events));
        return inTenantTransaction(tenantId, load)
                .onErrorMap(DataAccessException.class, e -> new EventStoreException(
                        "Failed to load events of aggregate " + aggregateId, e));
    }

    @Override
    public Mono<Long> getAggregateVersion(TenantId tenantId, UUID aggregateId) {
        return inTenantTransaction(tenantId, selectVersion(tenantId, aggregateId))
                .onErrorMap(DataAccessException.class, e -> new EventStoreException(
                        "Failed to read the version of aggregate " + aggregateId, e));
    }

    @Override
    public Mono<Boolean> isHealthy() {
        return databaseClient.sql("SELECT 1 AS ok")
                .map(row -> true)
                .first()
                .defaultIfEmpty(false)
                .doOnError(e -> log.warn("Event store health check failed: {}", e.getMessage()))
                .onErrorReturn(false);
    }

    private <T> Mono<T> inTenantTransaction(TenantId tenantId, Mono<T> work) {
        return tenantTransactions.execute(tenantId, work);
    }

    private Mono<Long> selectVersion(TenantId tenantId, UUID aggregateId) {
        return databaseClient.sql("""
                    SELECT COALESCE(MAX(version), 0) AS current_version
                    FROM domain_events
                    WHERE tenant_id = :tenantId AND aggregate_id = :aggregateId
                    """)
                .bind("tenantId", tenantId.value())
                .bind("aggregateId", aggregateId)
                .map(row -> row.get("current_version", Long.class))
                .one()
                .defaultIfEmpty(0L);
    }

    private Mono<Long> insert(TenantId tenantId, StoredEvent event) {
        return databaseClient.sql("""
                    INSERT INTO domain_events
                        (id, tenant_id, aggregate_id, aggregate_type, event_type, payload, metadata, version, created_at)
                    VALUES
                        (:id, :tenantId, :aggregateId, :aggregateType, :eventType,
                         CAST(:payload AS JSONB), CAST(:metadata AS JSONB), :version, :createdAt)
                    """)
                .bind("id", event.id())
                .bind("tenantId", tenantId.value())
                .bind("aggregateId", event.aggregateId())
                .bind("aggregateType", event.aggregateType())
                .bind("eventType", event.eventType())
                .bind("payload", event.payload())
                .bind("metadata", serializer.serializeMetadata(event.metadata()))
                .bind("version", event.version())
                .bind("createdAt", event.createdAt())
                .fetch()
                .rowsUpdated();
    }

    private StoredEvent mapRow(Readable row) {
        return new StoredEvent(
                row.get("id", UUID.class),
                row.get("aggregate_id", UUID.class),
                row.get("aggregate_type", String.class),
                row.get("event_type", String.class),
                row.get("payload", String.class),
                serializer.deserializeMetadata(row.get("metadata", String.class)),
                row.get("version", Long.class),
                row.get("created_at", Instant.class));
    }
}
