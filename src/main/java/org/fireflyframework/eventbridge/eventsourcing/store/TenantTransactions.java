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

import org.fireflyframework.eventbridge.tenant.TenantId;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;

/**
 * Runs R2DBC work in a transaction bound to one tenant.
 * <p>
 * The first statement of the transaction sets {@code app.tenant_id}, the setting
 * the row level security policies of the event store tables compare against. The
 * setting is transaction-local, so a pooled connection never carries a tenant into
 * its next use.
 */
public final class TenantTransactions {

    public static final String TENANT_SETTING = "app.tenant_id";

    private final DatabaseClient databaseClient;
    private final TransactionalOperator transactionalOperator;

    public TenantTransactions(DatabaseClient databaseClient, TransactionalOperator transactionalOperator) {
        this.databaseClient = databaseClient;
        this.transactionalOperator = transactionalOperator;
    }

    public <T> Mono<T> execute(TenantId tenantId, Mono<T> work) {
        Mono<Void> bindTenant = databaseClient.sql("SELECT set_config('" + TENANT_SETTING + "', :tenantId, true)")
                .bind("tenantId", tenantId.value())
                .fetch()
                .first()
                .then();
        return transactionalOperator.transactional(bindTenant.then(work));
    }
}
