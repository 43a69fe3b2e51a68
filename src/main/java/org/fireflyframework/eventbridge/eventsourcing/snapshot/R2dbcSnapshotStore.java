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

package org.fireflyframework.eventbridge.eventsourcing.snapshot;

import org.fireflyframework.eventbridge.eventsourcing.store.TenantTransactions;
import org.fireflyframework.eventbridge.exception.EventStoreException;
import org.fireflyframework.eventbridge.tenant.TenantId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.UUID;

/**
 * PostgreSQL {@link SnapshotStore} over the {@code aggregate_snapshots} table.
 * <p>
 * One row per {@code (tenant_id, aggregate_id)}. A save upserts the row only when
 * the new version is higher, so a slow writer cannot roll a snapshot back. Statements
 * run in tenant-bound transactions like the event store's.
 */
@Slf4j
public class R2dbcSnapshotStore implements SnapshotStore {

    private final DatabaseClient databaseClient;
    private final TenantTransactions tenantTransactions;

    public R2dbcSnapshotStore(DatabaseClient databaseClient, TransactionalOperator transactionalOperator) {
        this.databaseClient = databaseClient;
        this.tenantTransactions = new TenantTransactions(databaseClient, transactionalOperator);
    }

    @Override
    public Mono<Void> saveSnapshot(TenantId tenantId, AggregateSnapshot snapshot) {
        Mono<Long> upsert = databaseClient.sql("""
                    INSERT INTO aggregate_snapshots
                        (tenant_id, aggregate_id, aggregate_type, version, state, created_at)
                    VALUES
                        (:tenantId, :aggregateId, :aggregateType, :version, CAST(:state AS JSONB), :createdAt)
                    ON CONFLICT (tenant_id, aggregate_id) DO UPDATE
                        SET aggregate_type = EXCLUDED.aggregate_type,
                            version = EXCLUDED.version,
                            state = EXCLUDED.state,
                            created_at = EXCLUDED.created_at
                        WHERE aggregate_snapshots.version < EXCLUDED.version
                    """)
                .bind("tenantId", tenantId.value())
                .bind("aggregateId", snapshot.aggregateId())
                .bind("aggregateType", snapshot.aggregateType())
                .bind("version", snapshot.version())
                .bind("state", snapshot.state())
                .bind("createdAt", snapshot.createdAt())
                .fetch()
                .rowsUpdated();

        return tenantTransactions.execute(tenantId, upsert)
                .doOnNext(rows -> log.debug("Saved snapshot: tenant={}, aggregateId={}, version={}, rows={}",
                        tenantId, snapshot.aggregateId(), snapshot.version(), rows))
                .onErrorMap(DataAccessException.class, e -> new EventStoreException(
                        "Failed to save snapshot of aggregate " + snapshot.aggregateId(), e))
                .then();
    }

    @Override
    public Mono<AggregateSnapshot> loadSnapshot(TenantId tenantId, UUID aggregateId) {
        Mono<AggregateSnapshot> select = databaseClient.sql("""
                    SELECT aggregate_id, aggregate_type, version, state, created_at
                    FROM aggregate_snapshots
                    WHERE tenant_id = :tenantId AND aggregate_id = :aggregateId
                    """)
                .bind("tenantId", tenantId.value())
                .bind("aggregateId", aggregateId)
                .map(row -> new AggregateSnapshot(
                        row.get("aggregate_id", UUID.class),
                        row.get("aggregate_type", String.class),
                        row.get("version", Long.class),
                        row.get("state", String.class),
                        row.get("created_at", Instant.class)))
                .one();

        return tenantTransactions.execute(tenantId, select)
                .onErrorMap(DataAccessException.class, e -> new EventStoreException(
                        "Failed to load snapshot of aggregate " + aggregateId, e));
    }
}
