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

package org.fireflyframework.eventbridge.eventsourcing.aggregate;

import org.fireflyframework.eventbridge.eventsourcing.domain.AbstractDomainEvent;
import org.fireflyframework.eventbridge.exception.TenantIsolationException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Base class for event-sourced aggregates with immutable state.
 * <p>
 * State is a value of type {@code S} folded from the event stream by the pure
 * {@link #apply(Object, AbstractDomainEvent)} reducer. The same reducer runs for
 * freshly produced events and for replayed history, which is what makes replay
 * reproduce the state seen right after the original operations.
 * <p>
 * Command methods on subclasses validate against {@link #getState()} and call
 * {@link #applyChange(AbstractDomainEvent)}, which folds the event immediately and
 * buffers it as uncommitted. {@link #loadFromHistory(List)} folds without buffering.
 * <p>
 * The tenant of the first event becomes the aggregate's tenant; a later event
 * tagged with a different tenant is rejected.
 *
 * @param <S> the state type
 */
@Slf4j
public abstract class AggregateRoot<S> {

    @Getter
    private final UUID id;

    @Getter
    private final String aggregateType;

    @Getter
    private S state;

    @Getter
    private String tenantId;

    private long version;

    private final List<AbstractDomainEvent> uncommittedEvents = new ArrayList<>();

    protected AggregateRoot(UUID id, String aggregateType, S initialState) {
        this.id = id;
        this.aggregateType = aggregateType;
        this.state = initialState;
    }

    /**
     * Folds one event into the state. Must be free of side effects.
     *
     * @param state the current state
     * @param event the event to apply
     * @return the new state
     */
    protected abstract S apply(S state, AbstractDomainEvent event);

    /**
     * Applies a new event and records it as uncommitted.
     */
    protected void applyChange(AbstractDomainEvent event) {
        applyEvent(event, false);
    }

    /**
     * Replays persisted events in order. Replayed events are not buffered.
     */
    public void loadFromHistory(List<? extends AbstractDomainEvent> history) {
        for (AbstractDomainEvent event : history) {
            applyEvent(event, true);
        }
        log.debug("Replayed aggregate: type={}, id={}, events={}, version={}",
                aggregateType, id, history.size(), version);
    }

    private void applyEvent(AbstractDomainEvent event, boolean isReplay) {
        if (!id.equals(event.getAggregateId())) {
            throw new IllegalArgumentException("Event " + event.getEventType()
                    + " belongs to aggregate " + event.getAggregateId() + ", not " + id);
        }
        String eventTenant = event.getMetadata().tenantId();
        if (tenantId == null) {
            tenantId = eventTenant;
        } else if (!tenantId.equals(eventTenant)) {
            log.debug("Rejected event with foreign tenant: aggregateId={}, tenant={}, eventTenant={}",
                    id, tenantId, eventTenant);
            throw new TenantIsolationException();
        }

        state = apply(state, event);
        version++;
        if (!isReplay) {
            uncommittedEvents.add(event);
        }
    }

    /**
     * Restores the state captured by a snapshot. Events after {@code snapshotVersion}
     * are then replayed with {@link #loadFromHistory(List)}.
     *
     * @throws IllegalStateException if any event has already been applied
     */
    public void restoreFromSnapshot(S snapshotState, long snapshotVersion, String snapshotTenantId) {
        if (version != 0 || !uncommittedEvents.isEmpty()) {
            throw new IllegalStateException("Aggregate " + id + " already has state at version " + version);
        }
        if (snapshotVersion <= 0) {
            throw new IllegalArgumentException("Snapshot version must be positive: " + snapshotVersion);
        }
        this.state = snapshotState;
        this.version = snapshotVersion;
        this.tenantId = snapshotTenantId;
        log.debug("Restored aggregate from snapshot: type={}, id={}, version={}", aggregateType, id, snapshotVersion);
    }

    /**
     * Number of events applied, committed or not.
     */
    public long getCurrentVersion() {
        return version;
    }

    /**
     * Version of the stream as last read from or written to the store.
     */
    public long getCommittedVersion() {
        return version - uncommittedEvents.size();
    }

    public List<AbstractDomainEvent> getUncommittedEvents() {
        return List.copyOf(uncommittedEvents);
    }

    public boolean hasUncommittedEvents() {
        return !uncommittedEvents.isEmpty();
    }

    /**
     * Clears the uncommitted buffer after a successful append.
     */
    public void markEventsAsCommitted() {
        uncommittedEvents.clear();
    }
}
