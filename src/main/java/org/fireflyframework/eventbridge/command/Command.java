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

package org.fireflyframework.eventbridge.command;

import org.fireflyframework.eventbridge.tenant.TenantId;

import java.util.UUID;

/**
 * A request to change one aggregate, issued on behalf of one tenant.
 * <p>
 * Commands are records. The tenant is a required component, so a command
 * without a tenant cannot be built.
 */
public interface Command {

    /**
     * Actor id used for commands issued by the system rather than a user.
     */
    String SYSTEM_ACTOR = "system";

    /**
     * The tenant the command runs under.
     */
    TenantId tenantId();

    /**
     * The aggregate the command targets.
     */
    UUID aggregateId();

    /**
     * The user or system actor issuing the command.
     */
    String actorId();
}
