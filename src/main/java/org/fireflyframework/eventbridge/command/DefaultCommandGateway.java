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

import org.fireflyframework.eventbridge.exception.EventBridgeException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link CommandGateway} that dispatches on the exact command class.
 * <p>
 * Exactly one handler may be registered per command class; a second registration
 * fails, since silently replacing a handler would change routing at runtime.
 */
@Slf4j
public class DefaultCommandGateway implements CommandGateway {

    public static final String UNKNOWN_COMMAND = "UNKNOWN_COMMAND";

    private final Map<Class<? extends Command>, CommandHandler<? extends Command>> handlers = new ConcurrentHashMap<>();

    public DefaultCommandGateway() {
        this(List.of());
    }

    public DefaultCommandGateway(Collection<CommandHandlerRegistrar> registrars) {
        registrars.forEach(registrar -> registrar.registerHandlers(this));
        log.info("DefaultCommandGateway initialized with {} command handlers", handlers.size());
    }

    public <C extends Command> DefaultCommandGateway register(Class<C> commandType, CommandHandler<C> handler) {
        CommandHandler<? extends Command> existing = handlers.putIfAbsent(commandType, handler);
        if (existing != null) {
            throw new IllegalStateException("A handler is already registered for " + commandType.getName());
        }
        log.debug("Registered command handler: {}", commandType.getName());
        return this;
    }

    public Set<Class<? extends Command>> getRegisteredCommandTypes() {
        return Set.copyOf(handlers.keySet());
    }

    @Override
    public Mono<CommandResult> send(Command command) {
        return send(command, UUID.randomUUID().toString());
    }

    @Override
    @SuppressWarnings("unchecked")
    public Mono<CommandResult> send(Command command, String correlationId) {
        CommandHandler<Command> handler = (CommandHandler<Command>) handlers.get(command.getClass());
        if (handler == null) {
            return Mono.error(new EventBridgeException(UNKNOWN_COMMAND,
                    "No handler registered for " + command.getClass().getName()));
        }

        log.debug("Dispatching command: type={}, tenant={}, aggregateId={}, correlationId={}",
                command.getClass().getSimpleName(), command.tenantId(), command.aggregateId(), correlationId);
        return Mono.defer(() -> handler.handle(command, correlationId));
    }
}
