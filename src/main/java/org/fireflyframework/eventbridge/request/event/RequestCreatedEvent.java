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

package org.fireflyframework.eventbridge.request.event;

import org.fireflyframework.eventbridge.eventsourcing.domain.AbstractDomainEvent;
import org.fireflyframework.eventbridge.eventsourcing.domain.DomainEventType;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.util.UUID;

/**
 * Domain Event: a resource request has been submitted and awaits a decision.
 * <p>
 * First event of every request stream. Fixes the requester, which later
 * approve and reject decisions are checked against.
 */
@DomainEventType("request.created")
@SuperBuilder
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class RequestCreatedEvent extends AbstractDomainEvent {

    /**
     * The user who submitted the request.
     */
    private String requesterId;

    /**
     * The project the resource is requested for.
     */
    private UUID projectId;

    /**
     * Name of the requested resource.
     */
    private String resourceName;

    /**
     * Requested size class.
     */
    private String resourceSize;

    /**
     * Why the resource is needed.
     */
    private String justification;
}
