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

package org.fireflyframework.eventbridge.request.handler;

import org.fireflyframework.eventbridge.command.Command;
import org.fireflyframework.eventbridge.command.CommandHandlerRegistrar;
import org.fireflyframework.eventbridge.command.CommandResult;
import org.fireflyframework.eventbridge.command.DefaultCommandGateway;
import org.fireflyframework.eventbridge.eventsourcing.domain.EventMetadata;
import org.fireflyframework.eventbridge.eventsourcing.store.EventSourcedRepository;
import org.fireflyframework.eventbridge.request.ResourceRequestAggregate;
import org.fireflyframework.eventbridge.request.command.ApproveResourceRequestCommand;
import org.fireflyframework.eventbridge.request.command.CancelResourceRequestCommand;
import org.fireflyframework.eventbridge.request.command.CompleteProvisioningCommand;
import org.fireflyframework.eventbridge.request.command.CreateResourceRequestCommand;
import org.fireflyframework.eventbridge.request.command.FailProvisioningCommand;
import org.fireflyframework.eventbridge.request.command.RejectResourceRequestCommand;
import org.fireflyframework.eventbridge.request.command.StartProvisioningCommand;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.function.BiConsumer;

/**
 * Command handlers for {@link ResourceRequestAggregate}.
 * <p>
 * Each handler loads the request under the command's tenant, runs the aggregate
 * operation and saves the resulting events. A request that does not exist under
 * that tenant fails with not-found, whether it is missing or owned by another tenant.
 */
@Slf4j
@RequiredArgsConstructor
public class ResourceRequestCommandHandlers implements CommandHandlerRegistrar {

    private final EventSourcedRepository<ResourceRequestAggregate> repository;

    @Override
    public void registerHandlers(DefaultCommandGateway gateway) {
        gateway.register(CreateResourceRequestCommand.class, this::create)
                .register(ApproveResourceRequestCommand.class, this::approve)
                .register(RejectResourceRequestCommand.class, this::reject)
                .register(CancelResourceRequestCommand.class, this::cancel)
                .register(StartProvisioningCommand.class, this::startProvisioning)
                .register(CompleteProvisioningCommand.class, this::completeProvisioning)
                .register(FailProvisioningCommand.class, this::failProvisioning);
    }

    public Mono<CommandResult> create(CreateResourceRequestCommand command, String correlationId) {
        return Mono.fromCallable(() -> ResourceRequestAggregate.create(
                        command.requestId(),
                        command.projectId(),
                        command.requesterId(),
                        command.resourceName(),
                        command.resourceSize(),
                        command.justification(),
                        metadata(command, correlationId)))
                .flatMap(aggregate -> save(command, aggregate))
                .doOnSuccess(result -> log.info("Resource request created: id={}, tenant={}",
                        command.requestId(), command.tenantId()));
    }

    public Mono<CommandResult> approve(ApproveResourceRequestCommand command, String correlationId) {
        return update(command, correlationId,
                (aggregate, metadata) -> aggregate.approve(command.adminId(), metadata));
    }

    public Mono<CommandResult> reject(RejectResourceRequestCommand command, String correlationId) {
        return update(command, correlationId,
                (aggregate, metadata) -> aggregate.reject(command.adminId(), command.reason(), metadata));
    }

    public Mono<CommandResult> cancel(CancelResourceRequestCommand command, String correlationId) {
        return update(command, correlationId,
                (aggregate, metadata) -> aggregate.cancel(command.userId(), command.reason(), metadata));
    }

    public Mono<CommandResult> startProvisioning(StartProvisioningCommand command, String correlationId) {
        return update(command, correlationId,
                (aggregate, metadata) -> aggregate.markProvisioning(metadata));
    }

    public Mono<CommandResult> completeProvisioning(CompleteProvisioningCommand command, String correlationId) {
        return update(command, correlationId,
                (aggregate, metadata) -> aggregate.markReady(command.resourceId(), command.address(), metadata));
    }

    public Mono<CommandResult> failProvisioning(FailProvisioningCommand command, String correlationId) {
        return update(command, correlationId,
                (aggregate, metadata) -> aggregate.markFailed(command.errorCode(), command.errorMessage(), metadata));
    }

    private Mono<CommandResult> update(Command command, String correlationId,
                                       BiConsumer<ResourceRequestAggregate, EventMetadata> operation) {
        return repository.loadRequired(command.tenantId(), command.aggregateId())
                .flatMap(aggregate -> {
                    operation.accept(aggregate, metadata(command, correlationId));
                    return save(command, aggregate);
                });
    }

    private Mono<CommandResult> save(Command command, ResourceRequestAggregate aggregate) {
        return repository.save(command.tenantId(), aggregate)
                .map(stream -> new CommandResult(aggregate.getId(), aggregate.getCurrentVersion(), stream.events().size()));
    }

    private static EventMetadata metadata(Command command, String correlationId) {
        return EventMetadata.of(command.tenantId(), command.actorId(), correlationId);
    }
}
