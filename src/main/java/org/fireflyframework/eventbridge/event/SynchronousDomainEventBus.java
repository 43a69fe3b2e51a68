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

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process bus that runs subscribers one after another within the publisher's
 * subscription.
 * <p>
 * A failing subscriber is logged and does not prevent the remaining subscribers
 * from seeing the event; the event is already committed at this point.
 */
@Slf4j
public class SynchronousDomainEventBus implements DomainEventBus {

    private final List<DomainEventSubscriber> subscribers = new CopyOnWriteArrayList<>();

    @Override
    public Mono<Void> publish(EventEnvelope envelope) {
        return Flux.fromIterable(subscribers)
                .concatMap(subscriber -> Mono.defer(() -> subscriber.onEvent(envelope))
                        .onErrorResume(error -> !(error instanceof CancellationException), error -> {
                            log.error("Domain event subscriber failed: subscriber={}, eventType={}, aggregateId={}, version={}",
                                    subscriber.getClass().getSimpleName(),
                                    envelope.storedEvent().eventType(),
                                    envelope.storedEvent().aggregateId(),
                                    envelope.storedEvent().version(),
                                    error);
                            return Mono.empty();
                        }))
                .then();
    }

    @Override
    public void subscribe(DomainEventSubscriber subscriber) {
        subscribers.add(subscriber);
        log.info("Registered domain event subscriber: {}", subscriber.getClass().getSimpleName());
    }
}
