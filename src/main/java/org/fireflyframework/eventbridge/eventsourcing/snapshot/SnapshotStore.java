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

import org.fireflyframework.eventbridge.tenant.TenantId;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Keeps the latest snapshot per tenant and aggregate.
 * <p>
 * Like the event store, every operation takes the tenant explicitly and a snapshot
 * saved under one tenant is never returned under another. Saving an older version
 * than the one already stored leaves the stored snapshot in place.
 */
public interface SnapshotStore {

    /**
     * Stores the snapshot unless a snapshot with a higher or equal version exists.
     */
    Mono<Void> saveSnapshot(TenantId tenantId, AggregateSnapshot snapshot);

    /**
     * Loads the latest snapshot of an aggregate, empty if none was taken.
     */
    Mono<AggregateSnapshot> loadSnapshot(TenantId tenantId, UUID aggregateId);
}
