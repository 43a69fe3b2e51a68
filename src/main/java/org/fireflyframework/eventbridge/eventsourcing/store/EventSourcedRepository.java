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

package org.fireflyframework.eventbridge.eventsourcing.store;

import org.fireflyframework.eventbridge.event.DomainEventPublisher;
import org.fireflyframework.eventbridge.eventsourcing.aggregate.AggregateRoot;
import org.fireflyframework.eventbridge.eventsourcing.domain.AbstractDomainEvent;
import org.fireflyframework.eventbridge.eventsourcing.domain.EventStream;
import org.fireflyframework.eventbridge.eventsourcing.domain.StoredEvent;
import org.fireflyframework.eventbridge.eventsourcing.serialization.EventSerializer;
import org.fireflyframework.eventbridge.eventsourcing.snapshot.AggregateSnapshotter;
import org.fireflyframework.eventbridge.exception.AggregateNotFoundException;
import org.fireflyframework.eventbridge.exception.ConcurrencyConflictException;
import org.fireflyframework.eventbridge.metrics.BridgeMetrics;
import org.fireflyframework.eventbridge.projection.AggregateSummary;
import org.fireflyframework.eventbridge.projection.ProjectionUpdater;
import org.fireflyframework.eventbridge.tenant.TenantId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.UUID;
import java.util.function.BiFunction;

/**
 * Loads and saves aggregates of one type through the {@link EventStore}.
 * <p>
 * Saving appends the uncommitted events with the aggregate's committed version as
 * expected version, then notifies projections (fire-and-forget) and publishes the
 * batch on the domain event bus. A {@link ConcurrencyConflictException} leaves the
 * aggregate untouched; the caller reloads and recomputes.
 * <p>
 * With an {@link AggregateSnapshotter} configured, loading starts from the latest
 * snapshot and replays only the events after it, and a save that crosses the
 * snapshot threshold stores a new snapshot. Snapshot failures are logged and fall
 * back to a full replay; they never fail a load or a save.
 *
 * @param <A> the aggregate type
 */
@Slf4j
public class EventSourcedRepository<A extends AggregateRoot<?>> {

    private final EventStore eventStore;
    private final EventSerializer serializer;
    private final String aggregateType;
    private final BiFunction<UUID, List<AbstractDomainEvent>, A> reconstitutor;
    private final DomainEventPublisher eventPublisher;
    private final List<ProjectionUpdater> projectionUpdaters;
    private final BridgeMetrics metrics;
    private final AggregateSnapshotter<A> snapshotter;

    public EventSourcedRepository(EventStore eventStore,
                                  EventSerializer serializer,
                                  String aggregateType,
                                  BiFunction<UUID, List<AbstractDomainEvent>, A> reconstitutor,
                                  @Nullable DomainEventPublisher eventPublisher,
                                  List<ProjectionUpdater> projectionUpdaters,
                                  @Nullable BridgeMetrics metrics) {
        this(eventStore, serializer, aggregateType, reconstitutor, eventPublisher, projectionUpdaters, metrics, null);
    }

    public EventSourcedRepository(EventStore eventStore,
                                  EventSerializer serializer,
                                  String aggregateType,
                                  BiFunction<UUID, List<AbstractDomainEvent>, A> reconstitutor,
                                  @Nullable DomainEventPublisher eventPublisher,
                                  List<ProjectionUpdater> projectionUpdaters,
                                  @Nullable BridgeMetrics metrics,
                                  @Nullable AggregateSnapshotter<A> snapshotter) {
        this.eventStore = eventStore;
        this.serializer = serializer;
        this.aggregateType = aggregateType;
        this.reconstitutor = reconstitutor;
        this.eventPublisher = eventPublisher;
        this.projectionUpdaters = List.copyOf(projectionUpdaters);
        this.metrics = metrics;
        this.snapshotter = snapshotter;
    }

    /**
     * Loads an aggregate by replaying its event stream, starting from the latest
     * snapshot when one exists.
     *
     * @return the aggregate, or empty if no stream exists for this tenant
     */
    public Mono<A> load(TenantId tenantId, UUID aggregateId) {
        log.debug("Loading aggregate: type={}, id={}", aggregateType, aggregateId);

        return loadFromSnapshot(tenantId, aggregateId)
                .switchIfEmpty(Mono.defer(() -> replay(tenantId, aggregateId)))
                .doOnNext(aggregate -> log.debug("Loaded aggregate: type={}, id={}, version={}",
                        aggregateType, aggregateId, aggregate.getCurrentVersion()));
    }

    private Mono<A> replay(TenantId tenantId, UUID aggregateId) {
        return eventStore.loadEventStream(tenantId, aggregateId)
                .filter(stream -> !stream.isEmpty())
                .map(stream -> reconstitutor.apply(aggregateId, serializer.deserializeAll(stream.events())));
    }

    private Mono<A> loadFromSnapshot(TenantId tenantId, UUID aggregateId) {
        if (snapshotter == null) {
            return Mono.empty();
        }
        return snapshotter.restore(tenantId, aggregateId)
                .flatMap(aggregate -> {
                    long snapshotVersion = aggregate.getCurrentVersion();
                    // The event at the snapshot version is read too, to prove the snapshot lies on the stream.
                    return eventStore.loadEventStream(tenantId, aggregateId, snapshotVersion)
                            .flatMap(stream -> {
                                if (stream.isEmpty() || stream.events().get(0).version() != snapshotVersion) {
                                    log.warn("Snapshot does not line up with the stream, replaying in full: "
                                                    + "type={}, id={}, snapshotVersion={}",
                                            aggregateType, aggregateId, snapshotVersion);
                                    return Mono.empty();
                                }
                                List<StoredEvent> tail = stream.events().subList(1, stream.events().size());
                                aggregate.loadFromHistory(serializer.deserializeAll(tail));
                                log.debug("Replayed from snapshot: type={}, id={}, snapshotVersion={}, tailEvents={}",
                                        aggregateType, aggregateId, snapshotVersion, tail.size());
                                return Mono.just(aggregate);
                            });
                })
                .onErrorResume(error -> {
                    log.warn("Snapshot restore failed, replaying in full: type={}, id={}, error={}",
                            aggregateType, aggregateId, error.getMessage());
                    return Mono.empty();
                });
    }

    /**
     * Loads an aggregate, failing with {@link AggregateNotFoundException} if it does not exist.
     */
    public Mono<A> loadRequired(TenantId tenantId, UUID aggregateId) {
        return load(tenantId, aggregateId)
                .switchIfEmpty(Mono.defer(() -> {
                    log.debug("Aggregate not found: type={}, id={}, tenant={}", aggregateType, aggregateId, tenantId);
                    return Mono.error(new AggregateNotFoundException(aggregateType, aggregateId));
                }));
    }

    /**
     * Appends the aggregate's uncommitted events.
     *
     * @return the stored batch, empty when there was nothing to save
     */
    public Mono<EventStream> save(TenantId tenantId, A aggregate) {
        if (!aggregate.hasUncommittedEvents()) {
            log.debug("No uncommitted events for aggregate: {}", aggregate.getId());
            return Mono.just(EventStream.empty(aggregate.getId()));
        }

        List<AbstractDomainEvent> uncommittedEvents = aggregate.getUncommittedEvents();
        long expectedVersion = aggregate.getCommittedVersion();

        log.debug("Saving aggregate: type={}, id={}, uncommittedEvents={}, expectedVersion={}",
                aggregateType, aggregate.getId(), uncommittedEvents.size(), expectedVersion);

        return eventStore.appendEvents(tenantId, aggregate.getId(), aggregateType, uncommittedEvents, expectedVersion)
                .doOnError(ConcurrencyConflictException.class, e -> {
                    log.info("Concurrency conflict saving aggregate: type={}, id={}, expectedVersion={}, actualVersion={}",
                            aggregateType, aggregate.getId(), e.getExpectedVersion(), e.getActualVersion());
                    if (metrics != null) {
                        metrics.recordConcurrencyConflict(aggregateType);
                    }
                })
                .doOnNext(stream -> {
                    aggregate.markEventsAsCommitted();
                    if (metrics != null) {
                        metrics.recordEventsAppended(aggregateType, stream.events().size());
                    }
                    log.debug("Saved aggregate: type={}, id={}, newVersion={}",
                            aggregateType, aggregate.getId(), stream.getVersion());
                    notifyProjections(tenantId, aggregate, uncommittedEvents);
                })
                .flatMap(stream -> takeSnapshotIfDue(tenantId, aggregate, expectedVersion).thenReturn(stream))
                .flatMap(stream -> eventPublisher == null
                        ? Mono.just(stream)
                        : eventPublisher.publish(stream, uncommittedEvents).thenReturn(stream));
    }

    private Mono<Void> takeSnapshotIfDue(TenantId tenantId, A aggregate, long previousVersion) {
        if (snapshotter == null || !snapshotter.shouldSnapshot(previousVersion, aggregate.getCurrentVersion())) {
            return Mono.empty();
        }
        return snapshotter.snapshot(tenantId, aggregate)
                .doOnSuccess(ignored -> log.debug("Took snapshot: type={}, id={}, version={}",
                        aggregateType, aggregate.getId(), aggregate.getCurrentVersion()))
                .onErrorResume(error -> {
                    log.warn("Snapshot failed: type={}, id={}, version={}, error={}",
                            aggregateType, aggregate.getId(), aggregate.getCurrentVersion(), error.getMessage());
                    return Mono.empty();
                });
    }

    private void notifyProjections(TenantId tenantId, A aggregate, List<AbstractDomainEvent> events) {
        if (projectionUpdaters.isEmpty()) {
            return;
        }
        AggregateSummary summary = new AggregateSummary(
                tenantId,
                aggregate.getId(),
                aggregateType,
                aggregate.getCurrentVersion(),
                aggregate.getState(),
                events.stream().map(AbstractDomainEvent::getEventType).toList());

        for (ProjectionUpdater updater : projectionUpdaters) {
            Mono.defer(() -> updater.onCommitted(summary))
                    .subscribe(null, error -> log.warn(
                            "Projection update failed: updater={}, aggregateType={}, aggregateId={}, version={}",
                            updater.getClass().getSimpleName(), aggregateType, summary.aggregateId(),
                            summary.version(), error));
        }
    }
}
