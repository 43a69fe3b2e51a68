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

package org.fireflyframework.eventbridge.request;

import org.fireflyframework.eventbridge.eventsourcing.domain.AbstractDomainEvent;
import org.fireflyframework.eventbridge.eventsourcing.domain.EventMetadata;
import org.fireflyframework.eventbridge.exception.InvalidInputException;
import org.fireflyframework.eventbridge.exception.InvalidStateTransitionException;
import org.fireflyframework.eventbridge.exception.SeparationOfDutiesException;
import org.fireflyframework.eventbridge.exception.TenantIsolationException;
import org.fireflyframework.eventbridge.request.event.RequestApprovedEvent;
import org.fireflyframework.eventbridge.request.event.RequestCancelledEvent;
import org.fireflyframework.eventbridge.request.event.RequestCreatedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.fireflyframework.eventbridge.support.EventBridgeTestFixtures.*;

/**
 * Unit tests for {@link ResourceRequestAggregate}.
 * <p>
 * Tests cover the request lifecycle state machine, separation of duties,
 * idempotent cancellation, input validation and replay determinism.
 */
class ResourceRequestAggregateTest {

    private UUID requestId;
    private ResourceRequestAggregate aggregate;

    @BeforeEach
    void setUp() {
        requestId = UUID.randomUUID();
        aggregate = pendingRequest(requestId, TENANT_A);
    }

    private EventMetadata system() {
        return metadata(TENANT_A, "system");
    }

    /**
     * Moves the request to PROVISIONING.
     */
    private void provision() {
        aggregate.approve(ADMIN, metadata(TENANT_A, ADMIN));
        aggregate.markProvisioning(system());
    }

    // ========================================================================
    // Creation Tests
    // ========================================================================

    @Nested
    @DisplayName("create")
    class CreateTests {

        @Test
        @DisplayName("should start PENDING at version 1 with one uncommitted event")
        void create_shouldStartPending() {
            assertThat(aggregate.getStatus()).isEqualTo(RequestStatus.PENDING);
            assertThat(aggregate.getCurrentVersion()).isEqualTo(1);
            assertThat(aggregate.getCommittedVersion()).isZero();
            assertThat(aggregate.getTenantId()).isEqualTo(TENANT_A.value());
            assertThat(aggregate.getUncommittedEvents())
                    .singleElement()
                    .isInstanceOf(RequestCreatedEvent.class);
            assertThat(aggregate.getState().requesterId()).isEqualTo(REQUESTER);
            assertThat(aggregate.getState().justification()).isEqualTo(JUSTIFICATION);
        }

        @Test
        @DisplayName("should reject a justification that is too short")
        void create_shouldRejectShortJustification() {
            assertThatThrownBy(() -> ResourceRequestAggregate.create(UUID.randomUUID(), UUID.randomUUID(),
                    REQUESTER, RESOURCE_NAME, RESOURCE_SIZE, "too short", metadata(TENANT_A, REQUESTER)))
                    .isInstanceOf(InvalidInputException.class)
                    .extracting("field").isEqualTo("justification");
        }

        @Test
        @DisplayName("should reject an invalid resource name")
        void create_shouldRejectInvalidResourceName() {
            assertThatThrownBy(() -> ResourceRequestAggregate.create(UUID.randomUUID(), UUID.randomUUID(),
                    REQUESTER, "Invalid_Name", RESOURCE_SIZE, JUSTIFICATION, metadata(TENANT_A, REQUESTER)))
                    .isInstanceOf(InvalidInputException.class)
                    .extracting("field").isEqualTo("resourceName");
        }

        @Test
        @DisplayName("should reject a missing project")
        void create_shouldRejectMissingProject() {
            assertThatThrownBy(() -> ResourceRequestAggregate.create(UUID.randomUUID(), null,
                    REQUESTER, RESOURCE_NAME, RESOURCE_SIZE, JUSTIFICATION, metadata(TENANT_A, REQUESTER)))
                    .isInstanceOf(InvalidInputException.class);
        }
    }

    // ========================================================================
    // Decision Tests
    // ========================================================================

    @Nested
    @DisplayName("approve and reject")
    class DecisionTests {

        @Test
        @DisplayName("should approve a pending request")
        void approve_shouldMoveToApproved() {
            aggregate.approve(ADMIN, metadata(TENANT_A, ADMIN));

            assertThat(aggregate.getStatus()).isEqualTo(RequestStatus.APPROVED);
            assertThat(aggregate.getState().decidedBy()).isEqualTo(ADMIN);
            assertThat(aggregate.getCurrentVersion()).isEqualTo(2);
        }

        @Test
        @DisplayName("should forbid the requester from approving their own request")
        void approve_shouldEnforceSeparationOfDuties() {
            assertThatThrownBy(() -> aggregate.approve(REQUESTER, metadata(TENANT_A, REQUESTER)))
                    .isInstanceOf(SeparationOfDutiesException.class);
            assertThat(aggregate.getCurrentVersion()).isEqualTo(1);
        }

        @Test
        @DisplayName("should enforce separation of duties regardless of state")
        void decisions_shouldEnforceSeparationOfDutiesInAnyState() {
            aggregate.cancel(REQUESTER, null, metadata(TENANT_A, REQUESTER));

            assertThatThrownBy(() -> aggregate.approve(REQUESTER, metadata(TENANT_A, REQUESTER)))
                    .isInstanceOf(SeparationOfDutiesException.class);
            assertThatThrownBy(() -> aggregate.reject(REQUESTER, "not needed any more", metadata(TENANT_A, REQUESTER)))
                    .isInstanceOf(SeparationOfDutiesException.class);
        }

        @Test
        @DisplayName("should not approve twice")
        void approve_shouldRejectSecondApproval() {
            aggregate.approve(ADMIN, metadata(TENANT_A, ADMIN));

            assertThatThrownBy(() -> aggregate.approve("admin-2", metadata(TENANT_A, "admin-2")))
                    .isInstanceOf(InvalidStateTransitionException.class)
                    .extracting("currentState").isEqualTo("APPROVED");
        }

        @Test
        @DisplayName("should reject with a trimmed reason")
        void reject_shouldStoreReason() {
            aggregate.reject(ADMIN, "  Budget exceeded for this quarter  ", metadata(TENANT_A, ADMIN));

            assertThat(aggregate.getStatus()).isEqualTo(RequestStatus.REJECTED);
            assertThat(aggregate.getState().decisionReason()).isEqualTo("Budget exceeded for this quarter");
        }

        @Test
        @DisplayName("should require a rejection reason of at least 10 characters")
        void reject_shouldValidateReasonLength() {
            assertThatThrownBy(() -> aggregate.reject(ADMIN, "no", metadata(TENANT_A, ADMIN)))
                    .isInstanceOf(InvalidInputException.class);
            assertThatThrownBy(() -> aggregate.reject(ADMIN, "x".repeat(501), metadata(TENANT_A, ADMIN)))
                    .isInstanceOf(InvalidInputException.class);
            assertThat(aggregate.getStatus()).isEqualTo(RequestStatus.PENDING);
        }
    }

    // ========================================================================
    // Cancellation Tests
    // ========================================================================

    @Nested
    @DisplayName("cancel")
    class CancelTests {

        @Test
        @DisplayName("should cancel a pending request")
        void cancel_shouldMoveToCancelled() {
            aggregate.cancel(REQUESTER, "No longer needed", metadata(TENANT_A, REQUESTER));

            assertThat(aggregate.getStatus()).isEqualTo(RequestStatus.CANCELLED);
            assertThat(aggregate.getCurrentVersion()).isEqualTo(2);
        }

        @Test
        @DisplayName("should be a no-op when already cancelled")
        void cancel_shouldBeIdempotent() {
            aggregate.cancel(REQUESTER, "No longer needed", metadata(TENANT_A, REQUESTER));
            aggregate.markEventsAsCommitted();

            aggregate.cancel(REQUESTER, "No longer needed", metadata(TENANT_A, REQUESTER));

            assertThat(aggregate.hasUncommittedEvents()).isFalse();
            assertThat(aggregate.getCurrentVersion()).isEqualTo(2);
        }

        @Test
        @DisplayName("should fail from a non-cancellable state")
        void cancel_shouldFailFromReady() {
            provision();
            aggregate.markReady("res-1", "10.0.0.1", system());

            assertThatThrownBy(() -> aggregate.cancel(REQUESTER, null, metadata(TENANT_A, REQUESTER)))
                    .isInstanceOf(InvalidStateTransitionException.class)
                    .extracting("currentState").isEqualTo("READY");
        }

        @Test
        @DisplayName("should fail from APPROVED")
        void cancel_shouldFailFromApproved() {
            aggregate.approve(ADMIN, metadata(TENANT_A, ADMIN));

            assertThatThrownBy(() -> aggregate.cancel(REQUESTER, null, metadata(TENANT_A, REQUESTER)))
                    .isInstanceOf(InvalidStateTransitionException.class);
        }

        @Test
        @DisplayName("should limit the cancellation reason to 500 characters")
        void cancel_shouldValidateReasonLength() {
            assertThatThrownBy(() -> aggregate.cancel(REQUESTER, "x".repeat(501), metadata(TENANT_A, REQUESTER)))
                    .isInstanceOf(InvalidInputException.class);
        }
    }

    // ========================================================================
    // Provisioning Tests
    // ========================================================================

    @Nested
    @DisplayName("provisioning")
    class ProvisioningTests {

        @Test
        @DisplayName("should move APPROVED to PROVISIONING to READY")
        void provisioning_shouldReachReady() {
            provision();
            aggregate.markReady("res-1", "10.0.0.1", system());

            assertThat(aggregate.getStatus()).isEqualTo(RequestStatus.READY);
            assertThat(aggregate.getState().resourceId()).isEqualTo("res-1");
            assertThat(aggregate.getState().address()).isEqualTo("10.0.0.1");
            assertThat(aggregate.getCurrentVersion()).isEqualTo(4);
        }

        @Test
        @DisplayName("should record a provisioning failure")
        void provisioning_shouldReachFailed() {
            provision();
            aggregate.markFailed("QUOTA_EXCEEDED", "Quota exceeded", system());

            assertThat(aggregate.getStatus()).isEqualTo(RequestStatus.FAILED);
            assertThat(aggregate.getState().failureCode()).isEqualTo("QUOTA_EXCEEDED");
        }

        @Test
        @DisplayName("should not start provisioning a pending request")
        void markProvisioning_shouldRequireApproval() {
            assertThatThrownBy(() -> aggregate.markProvisioning(system()))
                    .isInstanceOf(InvalidStateTransitionException.class);
        }

        @Test
        @DisplayName("should accept no transition out of a terminal state")
        void terminalStates_shouldRejectTransitions() {
            aggregate.reject(ADMIN, "Budget exceeded for this quarter", metadata(TENANT_A, ADMIN));

            assertThat(aggregate.getStatus().isTerminal()).isTrue();
            assertThatThrownBy(() -> aggregate.markProvisioning(system()))
                    .isInstanceOf(InvalidStateTransitionException.class);
            assertThatThrownBy(() -> aggregate.markReady("res-1", "10.0.0.1", system()))
                    .isInstanceOf(InvalidStateTransitionException.class);
        }
    }

    // ========================================================================
    // Replay Tests
    // ========================================================================

    @Nested
    @DisplayName("reconstitute")
    class ReplayTests {

        @Test
        @DisplayName("should reproduce the state produced by the original operations")
        void reconstitute_shouldBeDeterministic() {
            List<AbstractDomainEvent> history = new ArrayList<>(aggregate.getUncommittedEvents());
            aggregate.markEventsAsCommitted();
            provision();
            aggregate.markFailed("QUOTA_EXCEEDED", "Quota exceeded", system());
            history.addAll(aggregate.getUncommittedEvents());

            ResourceRequestAggregate replayed = ResourceRequestAggregate.reconstitute(requestId, history);

            assertThat(replayed.getState()).isEqualTo(aggregate.getState());
            assertThat(replayed.getCurrentVersion()).isEqualTo(aggregate.getCurrentVersion());
            assertThat(replayed.getTenantId()).isEqualTo(aggregate.getTenantId());
        }

        @Test
        @DisplayName("should not buffer replayed events")
        void reconstitute_shouldNotBufferEvents() {
            ResourceRequestAggregate replayed = ResourceRequestAggregate.reconstitute(requestId,
                    aggregate.getUncommittedEvents());

            assertThat(replayed.hasUncommittedEvents()).isFalse();
            assertThat(replayed.getCommittedVersion()).isEqualTo(1);
        }

        @Test
        @DisplayName("should refuse events of another tenant")
        void reconstitute_shouldRejectForeignTenant() {
            List<AbstractDomainEvent> history = new ArrayList<>(aggregate.getUncommittedEvents());
            history.add(RequestApprovedEvent.builder()
                    .aggregateId(requestId)
                    .metadata(metadata(TENANT_B, ADMIN))
                    .approvedBy(ADMIN)
                    .build());

            assertThatThrownBy(() -> ResourceRequestAggregate.reconstitute(requestId, history))
                    .isInstanceOf(TenantIsolationException.class);
        }

        @Test
        @DisplayName("should refuse events of another aggregate")
        void reconstitute_shouldRejectForeignAggregate() {
            List<AbstractDomainEvent> history = List.of(RequestCancelledEvent.builder()
                    .aggregateId(UUID.randomUUID())
                    .metadata(metadata(TENANT_A, REQUESTER))
                    .cancelledBy(REQUESTER)
                    .build());

            assertThatThrownBy(() -> ResourceRequestAggregate.reconstitute(requestId, history))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
