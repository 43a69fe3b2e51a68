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

package org.fireflyframework.eventbridge.request.command;

import org.fireflyframework.eventbridge.bridge.dispatch.WorkflowCommand;
import org.fireflyframework.eventbridge.command.Command;
import org.fireflyframework.eventbridge.tenant.TenantId;

import java.util.Objects;
import java.util.UUID;

/**
 * Records a successfully provisioned resource.
 */
@WorkflowCommand(name = "request.provisioning.complete")
public record CompleteProvisioningCommand(
        TenantId tenantId,
        UUID requestId,
        String resourceId,
        String address
) implements Command {

    public CompleteProvisioningCommand {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(requestId, "requestId");
    }

    @Override
    public UUID aggregateId() {
        return requestId;
    }

    @Override
    public String actorId() {
        return SYSTEM_ACTOR;
    }
}
