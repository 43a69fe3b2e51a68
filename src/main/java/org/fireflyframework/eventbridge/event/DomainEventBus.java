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

import reactor.core.publisher.Mono;

/**
 * Distributes committed domain events to subscribers.
 * <p>
 * Whether the returned {@code Mono} completes before or after subscribers have
 * finished depends on the implementation. With {@link SynchronousDomainEventBus} it
 * completes only after every subscriber has handled the event.
 */
public interface DomainEventBus {

    Mono<Void> publish(EventEnvelope envelope);

    void subscribe(DomainEventSubscriber subscriber);
}
