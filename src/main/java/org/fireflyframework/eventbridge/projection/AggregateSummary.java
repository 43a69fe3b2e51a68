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

package org.fireflyframework.eventbridge.projection;

import org.fireflyframework.eventbridge.tenant.TenantId;

import java.util.List;
import java.util.UUID;

/**
 * State of an aggregate right after a successful append.
 *
 * @param tenantId      the owning tenant
 * @param aggregateId   the aggregate
 * @param aggregateType the aggregate type tag
 * @param version       the version after the append
 * @param state         the aggregate's folded state
 * @param eventTypes    type tags of the appended events, in order
 */
public record AggregateSummary(
        TenantId tenantId,
        UUID aggregateId,
        String aggregateType,
        long version,
        Object state,
        List<String> eventTypes
) {}
