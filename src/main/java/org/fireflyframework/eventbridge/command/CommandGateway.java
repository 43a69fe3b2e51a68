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

import reactor.core.publisher.Mono;

/**
 * Routes commands to the handler of their type.
 * <p>
 * Failures are signalled as errors: concurrency conflicts, state-machine,
 * separation-of-duties and input violations from the aggregate, not-found for
 * streams missing under the command's tenant, and persistence failures.
 */
public interface CommandGateway {

    /**
     * Sends a command with a freshly generated correlation id.
     */
    Mono<CommandResult> send(Command command);

    /**
     * Sends a command, recording the given correlation id on the produced events.
     */
    Mono<CommandResult> send(Command command, String correlationId);
}
