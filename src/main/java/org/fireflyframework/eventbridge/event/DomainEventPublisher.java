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

package org.fireflyframework.eventbridge.event;

import org.fireflyframework.eventbridge.eventsourcing.domain.AbstractDomainEvent;
import org.fireflyframework.eventbridge.eventsourcing.domain.EventStream;
import org.fireflyframework.eventbridge.eventsourcing.domain.StoredEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Publishes a committed batch on the {@link DomainEventBus}, one envelope per event,
 * in version order.
 */
@Slf4j
@RequiredArgsConstructor
public class DomainEventPublisher {

    private final DomainEventBus eventBus;
    private final CorrelationContextResolver correlationResolver;

    /**
     * @param committed the stored batch as returned by the event store
     * @param events    the typed events of the batch, in the same order
     */
    public Mono<Void> publish(EventStream committed, List<? extends AbstractDomainEvent> events) {
        if (committed.events().size() != events.size()) {
            return Mono.error(new IllegalArgumentException("Committed batch has " + committed.events().size()
                    + " events but " + events.size() + " typed events were given"));
        }

        return Flux.range(0, events.size())
                .concatMap(index -> {
                    StoredEvent stored = committed.events().get(index);
                    EventEnvelope envelope = new EventEnvelope(stored, events.get(index),
                            correlationResolver.resolve(stored));
                    log.debug("Publishing domain event: type={}, aggregateId={}, version={}, messageName={}",
                            stored.eventType(), stored.aggregateId(), stored.version(),
                            envelope.correlation().messageName());
                    return eventBus.publish(envelope);
                })
                .then();
    }
}
