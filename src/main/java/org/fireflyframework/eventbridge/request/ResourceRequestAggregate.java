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

import org.fireflyframework.eventbridge.eventsourcing.aggregate.AggregateRoot;
import org.fireflyframework.eventbridge.eventsourcing.domain.AbstractDomainEvent;
import org.fireflyframework.eventbridge.eventsourcing.domain.EventMetadata;
import org.fireflyframework.eventbridge.exception.InvalidInputException;
import org.fireflyframework.eventbridge.exception.InvalidStateTransitionException;
import org.fireflyframework.eventbridge.exception.SeparationOfDutiesException;
import org.fireflyframework.eventbridge.request.event.ProvisioningFailedEvent;
import org.fireflyframework.eventbridge.request.event.ProvisioningStartedEvent;
import org.fireflyframework.eventbridge.request.event.RequestApprovedEvent;
import org.fireflyframework.eventbridge.request.event.RequestCancelledEvent;
import org.fireflyframework.eventbridge.request.event.RequestCreatedEvent;
import org.fireflyframework.eventbridge.request.event.RequestRejectedEvent;
import org.fireflyframework.eventbridge.request.event.ResourceReadyEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Event-sourced aggregate for the lifecycle of a resource request.
 * <p>
 * <b>Lifecycle:</b> PENDING -> APPROVED | REJECTED | CANCELLED, APPROVED -> PROVISIONING,
 * PROVISIONING -> READY | FAILED.
 * <p>
 * Approve and reject enforce separation of duties: the deciding administrator may not
 * be the requester. That check runs before the state check, so a self-decision is
 * reported as such whatever the current status. Cancel is idempotent on an already
 * cancelled request.
 *
 * @see RequestStatus
 */
@Slf4j
public class ResourceRequestAggregate extends AggregateRoot<ResourceRequestState> {

    public static final String AGGREGATE_TYPE = "resource-request";

    public static final int MIN_JUSTIFICATION_LENGTH = 10;
    public static final int MAX_JUSTIFICATION_LENGTH = 1000;
    public static final int MIN_REJECT_REASON_LENGTH = 10;
    public static final int MAX_REASON_LENGTH = 500;

    private static final Pattern RESOURCE_NAME = Pattern.compile("^[a-z][a-z0-9-]{1,61}[a-z0-9]$");

    /**
     * All event classes of this aggregate, for type registration.
     */
    public static final List<Class<? extends AbstractDomainEvent>> EVENT_TYPES = List.of(
            RequestCreatedEvent.class,
            RequestApprovedEvent.class,
            RequestRejectedEvent.class,
            RequestCancelledEvent.class,
            ProvisioningStartedEvent.class,
            ResourceReadyEvent.class,
            ProvisioningFailedEvent.class);

    private ResourceRequestAggregate(UUID id) {
        super(id, AGGREGATE_TYPE, ResourceRequestState.initial(id));
    }

    // ========================================================================
    // Factory Methods
    // ========================================================================

    /**
     * Submits a new request. Emits {@link RequestCreatedEvent}.
     *
     * @throws InvalidInputException if any argument is missing or out of range
     */
    public static ResourceRequestAggregate create(UUID requestId,
                                                  UUID projectId,
                                                  String requesterId,
                                                  String resourceName,
                                                  String resourceSize,
                                                  String justification,
                                                  EventMetadata metadata) {
        requireText("requesterId", requesterId);
        if (projectId == null) {
            throw new InvalidInputException("projectId", "Project id is required");
        }
        if (resourceName == null || !RESOURCE_NAME.matcher(resourceName).matches()) {
            throw new InvalidInputException("resourceName",
                    "Resource name must be 3-63 lower-case letters, digits or hyphens, starting with a letter");
        }
        requireText("resourceSize", resourceSize);
        String trimmedJustification = justification == null ? "" : justification.trim();
        if (trimmedJustification.length() < MIN_JUSTIFICATION_LENGTH
                || trimmedJustification.length() > MAX_JUSTIFICATION_LENGTH) {
            throw new InvalidInputException("justification", "Justification must be between "
                    + MIN_JUSTIFICATION_LENGTH + " and " + MAX_JUSTIFICATION_LENGTH + " characters");
        }

        ResourceRequestAggregate aggregate = new ResourceRequestAggregate(requestId);
        aggregate.applyChange(RequestCreatedEvent.builder()
                .aggregateId(requestId)
                .metadata(metadata)
                .requesterId(requesterId)
                .projectId(projectId)
                .resourceName(resourceName)
                .resourceSize(resourceSize)
                .justification(trimmedJustification)
                .build());
        log.debug("Created resource request: id={}, requester={}, resource={}", requestId, requesterId, resourceName);
        return aggregate;
    }

    /**
     * Rebuilds a request from its persisted events.
     */
    public static ResourceRequestAggregate reconstitute(UUID requestId, List<? extends AbstractDomainEvent> events) {
        ResourceRequestAggregate aggregate = new ResourceRequestAggregate(requestId);
        aggregate.loadFromHistory(events);
        return aggregate;
    }

    // ========================================================================
    // Command Methods (validate state + applyChange)
    // ========================================================================

    /**
     * Approves a pending request.
     *
     * @throws SeparationOfDutiesException if the administrator is the requester
     * @throws InvalidStateTransitionException if the request is not PENDING
     */
    public void approve(String adminId, EventMetadata metadata) {
        requireCreated("approve");
        requireNotRequester(adminId, "approve");
        requireStatus(RequestStatus.PENDING, "approve");

        applyChange(RequestApprovedEvent.builder()
                .aggregateId(getId())
                .metadata(metadata)
                .approvedBy(adminId)
                .build());
    }

    /**
     * Rejects a pending request with a reason of 10 to 500 characters.
     *
     * @throws SeparationOfDutiesException if the administrator is the requester
     * @throws InvalidStateTransitionException if the request is not PENDING
     * @throws InvalidInputException if the reason length is out of range
     */
    public void reject(String adminId, String reason, EventMetadata metadata) {
        requireCreated("reject");
        requireNotRequester(adminId, "reject");
        requireStatus(RequestStatus.PENDING, "reject");
        String trimmedReason = reason == null ? "" : reason.trim();
        if (trimmedReason.length() < MIN_REJECT_REASON_LENGTH || trimmedReason.length() > MAX_REASON_LENGTH) {
            throw new InvalidInputException("reason", "Rejection reason must be between "
                    + MIN_REJECT_REASON_LENGTH + " and " + MAX_REASON_LENGTH + " characters");
        }

        applyChange(RequestRejectedEvent.builder()
                .aggregateId(getId())
                .metadata(metadata)
                .rejectedBy(adminId)
                .reason(trimmedReason)
                .build());
    }

    /**
     * Cancels a pending request. A no-op when the request is already cancelled.
     *
     * @throws InvalidStateTransitionException if the request is neither PENDING nor CANCELLED
     * @throws InvalidInputException if the reason is longer than 500 characters
     */
    public void cancel(String userId, String reason, EventMetadata metadata) {
        requireCreated("cancel");
        RequestStatus status = getState().status();
        if (status == RequestStatus.CANCELLED) {
            log.debug("Request already cancelled, ignoring: id={}", getId());
            return;
        }
        if (!status.isCancellable()) {
            throw new InvalidStateTransitionException(status.name(), "cancel");
        }
        requireText("userId", userId);
        if (reason != null && reason.length() > MAX_REASON_LENGTH) {
            throw new InvalidInputException("reason",
                    "Cancellation reason must not exceed " + MAX_REASON_LENGTH + " characters");
        }

        applyChange(RequestCancelledEvent.builder()
                .aggregateId(getId())
                .metadata(metadata)
                .cancelledBy(userId)
                .reason(reason)
                .build());
    }

    /**
     * Starts provisioning an approved request.
     */
    public void markProvisioning(EventMetadata metadata) {
        requireCreated("start provisioning");
        requireStatus(RequestStatus.APPROVED, "start provisioning");

        applyChange(ProvisioningStartedEvent.builder()
                .aggregateId(getId())
                .metadata(metadata)
                .build());
    }

    /**
     * Records that the resource is provisioned and reachable.
     */
    public void markReady(String resourceId, String address, EventMetadata metadata) {
        requireCreated("mark ready");
        requireStatus(RequestStatus.PROVISIONING, "mark ready");
        requireText("resourceId", resourceId);

        applyChange(ResourceReadyEvent.builder()
                .aggregateId(getId())
                .metadata(metadata)
                .resourceId(resourceId)
                .address(address)
                .build());
    }

    /**
     * Records that provisioning failed.
     */
    public void markFailed(String errorCode, String errorMessage, EventMetadata metadata) {
        requireCreated("mark failed");
        requireStatus(RequestStatus.PROVISIONING, "mark failed");
        requireText("errorCode", errorCode);

        applyChange(ProvisioningFailedEvent.builder()
                .aggregateId(getId())
                .metadata(metadata)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .build());
    }

    public RequestStatus getStatus() {
        return getState().status();
    }

    // ========================================================================
    // Event Application
    // ========================================================================

    @Override
    protected ResourceRequestState apply(ResourceRequestState state, AbstractDomainEvent event) {
        var timestamp = event.getMetadata().timestamp();

        if (event instanceof RequestCreatedEvent created) {
            return state.withStatus(RequestStatus.PENDING)
                    .withRequesterId(created.getRequesterId())
                    .withProjectId(created.getProjectId())
                    .withResourceName(created.getResourceName())
                    .withResourceSize(created.getResourceSize())
                    .withJustification(created.getJustification())
                    .withCreatedAt(timestamp)
                    .withUpdatedAt(timestamp);
        }
        if (event instanceof RequestApprovedEvent approved) {
            return state.withStatus(RequestStatus.APPROVED)
                    .withDecidedBy(approved.getApprovedBy())
                    .withUpdatedAt(timestamp);
        }
        if (event instanceof RequestRejectedEvent rejected) {
            return state.withStatus(RequestStatus.REJECTED)
                    .withDecidedBy(rejected.getRejectedBy())
                    .withDecisionReason(rejected.getReason())
                    .withUpdatedAt(timestamp);
        }
        if (event instanceof RequestCancelledEvent cancelled) {
            return state.withStatus(RequestStatus.CANCELLED)
                    .withDecisionReason(cancelled.getReason())
                    .withUpdatedAt(timestamp);
        }
        if (event instanceof ProvisioningStartedEvent) {
            return state.withStatus(RequestStatus.PROVISIONING)
                    .withUpdatedAt(timestamp);
        }
        if (event instanceof ResourceReadyEvent ready) {
            return state.withStatus(RequestStatus.READY)
                    .withResourceId(ready.getResourceId())
                    .withAddress(ready.getAddress())
                    .withUpdatedAt(timestamp);
        }
        if (event instanceof ProvisioningFailedEvent failed) {
            return state.withStatus(RequestStatus.FAILED)
                    .withFailureCode(failed.getErrorCode())
                    .withFailureMessage(failed.getErrorMessage())
                    .withUpdatedAt(timestamp);
        }
        throw new IllegalArgumentException("Unsupported event for " + AGGREGATE_TYPE + ": " + event.getEventType());
    }

    // ========================================================================
    // Guards
    // ========================================================================

    private void requireCreated(String operation) {
        if (!getState().isCreated()) {
            throw new InvalidStateTransitionException("NOT_CREATED", operation);
        }
    }

    private void requireStatus(RequestStatus expected, String operation) {
        RequestStatus status = getState().status();
        if (status != expected) {
            throw new InvalidStateTransitionException(status.name(), operation);
        }
    }

    private void requireNotRequester(String actorId, String operation) {
        requireText("adminId", actorId);
        if (actorId.equals(getState().requesterId())) {
            throw new SeparationOfDutiesException(actorId, operation);
        }
    }

    private static void requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidInputException(field, field + " is required");
        }
    }
}
