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

import org.fireflyframework.eventbridge.request.RequestStatus;
import org.fireflyframework.eventbridge.request.ResourceRequestAggregate;
import org.fireflyframework.eventbridge.request.ResourceRequestState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.fireflyframework.eventbridge.support.EventBridgeTestFixtures.*;

/**
 * Unit tests for {@link AggregateSnapshotter} and {@link InMemorySnapshotStore}.
 */
class AggregateSnapshotterTest {

    private InMemorySnapshotStore snapshotStore;
    private AggregateSnapshotter<ResourceRequestAggregate> snapshotter;
    private UUID requestId;

    @BeforeEach
    void setUp() {
        snapshotStore = new InMemorySnapshotStore();
        snapshotter = AggregateSnapshotter.of(snapshotStore, serializer(), ResourceRequestState.class,
                id -> ResourceRequestAggregate.reconstitute(id, List.of()), 10);
        requestId = UUID.randomUUID();
    }

    // ========================================================================
    // Threshold Tests
    // ========================================================================

    @Nested
    @DisplayName("shouldSnapshot")
    class ThresholdTests {

        @Test
        @DisplayName("should snapshot when a save reaches or crosses a multiple of the threshold")
        void shouldSnapshot_atBoundary() {
            assertThat(snapshotter.shouldSnapshot(9, 10)).isTrue();
            assertThat(snapshotter.shouldSnapshot(8, 12)).isTrue();
            assertThat(snapshotter.shouldSnapshot(10, 11)).isFalse();
            assertThat(snapshotter.shouldSnapshot(0, 9)).isFalse();
        }

        @Test
        @DisplayName("should refuse a threshold below one")
        void shouldRejectNonPositiveThreshold() {
            assertThatThrownBy(() -> AggregateSnapshotter.of(snapshotStore, serializer(), ResourceRequestState.class,
                    id -> ResourceRequestAggregate.reconstitute(id, List.of()), 0))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    // ========================================================================
    // Snapshot and Restore Tests
    // ========================================================================

    @Nested
    @DisplayName("snapshot and restore")
    class RestoreTests {

        @Test
        @DisplayName("should restore state, version and tenant from the latest snapshot")
        void restore_shouldInstallSnapshot() {
            ResourceRequestAggregate aggregate = pendingRequest(requestId, TENANT_A);
            aggregate.approve(ADMIN, metadata(TENANT_A, ADMIN));

            StepVerifier.create(snapshotter.snapshot(TENANT_A, aggregate)
                            .then(snapshotter.restore(TENANT_A, requestId)))
                    .assertNext(restored -> {
                        assertThat(restored.getState()).isEqualTo(aggregate.getState());
                        assertThat(restored.getStatus()).isEqualTo(RequestStatus.APPROVED);
                        assertThat(restored.getCurrentVersion()).isEqualTo(2);
                        assertThat(restored.getCommittedVersion()).isEqualTo(2);
                        assertThat(restored.getTenantId()).isEqualTo(TENANT_A.value());
                        assertThat(restored.hasUncommittedEvents()).isFalse();
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should complete empty when no snapshot exists for the tenant")
        void restore_shouldBeEmptyWithoutSnapshot() {
            StepVerifier.create(snapshotter.snapshot(TENANT_A, pendingRequest(requestId, TENANT_A))
                            .then(snapshotter.restore(TENANT_B, requestId)))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should keep the newer snapshot when an older one is saved later")
        void saveSnapshot_shouldKeepHighestVersion() {
            AggregateSnapshot newer = new AggregateSnapshot(requestId, "resource-request", 20, "{}", Instant.now());
            AggregateSnapshot older = new AggregateSnapshot(requestId, "resource-request", 10, "{}", Instant.now());

            StepVerifier.create(snapshotStore.saveSnapshot(TENANT_A, newer)
                            .then(snapshotStore.saveSnapshot(TENANT_A, older))
                            .then(snapshotStore.loadSnapshot(TENANT_A, requestId)))
                    .assertNext(loaded -> assertThat(loaded.version()).isEqualTo(20))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should refuse to restore a snapshot over applied events")
        void restoreFromSnapshot_shouldRejectNonEmptyAggregate() {
            ResourceRequestAggregate aggregate = pendingRequest(requestId, TENANT_A);

            assertThatThrownBy(() -> aggregate.restoreFromSnapshot(aggregate.getState(), 5, TENANT_A.value()))
                    .isInstanceOf(IllegalStateException.class);
        }
    }
}
