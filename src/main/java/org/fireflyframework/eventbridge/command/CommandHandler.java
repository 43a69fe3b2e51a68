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
 * Handles one command type: loads the aggregate, runs the operation and appends
 * the resulting events.
 *
 * @param <C> the command type
 */
@FunctionalInterface
public interface CommandHandler<C extends Command> {

    /**
     * @param command       the command
     * @param correlationId correlation id recorded in the metadata of the produced events
     * @return the result, or an error carrying the typed domain or persistence failure
     */
    Mono<CommandResult> handle(C command, String correlationId);
}
