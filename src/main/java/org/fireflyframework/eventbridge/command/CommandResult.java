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

import java.util.UUID;

/**
 * Successful outcome of a command.
 *
 * @param aggregateId    the aggregate that handled the command
 * @param version        the aggregate version after the command
 * @param eventsAppended number of events the command appended, 0 for an idempotent no-op
 */
public record CommandResult(
        UUID aggregateId,
        long version,
        int eventsAppended
) {}
