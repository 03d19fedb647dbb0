/*
 * Copyright 2022 - 2025 The Original Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 *     you may not use this file except in compliance with the License.
 *     You may obtain a copy of the License at
 *
 *           http://www.apache.org/licenses/LICENSE-2.0
 *
 *     Unless required by applicable law or agreed to in writing, software
 *     distributed under the License is distributed on an "AS IS" BASIS,
 *     WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *     See the License for the specific language governing permissions and
 *     limitations under the License.
 *
 */

package org.elasticsoftware.eventflow.aggregate;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.elasticsoftware.eventflow.events.DomainEvent;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

public final class AggregatorRuntimeBuilder<S> {
    private final String name;
    private final Class<S> stateClass;
    private final AggregatorValidator validator;
    private final Map<String, DomainEventType<?>> domainEventTypes = new HashMap<>();
    private final Map<String, EventSourcingHandlerFunction<S, DomainEvent>> eventSourcingHandlers = new HashMap<>();
    private final List<EventSourcingHookFunction<S>> beforeHooks = new ArrayList<>();
    private final List<EventSourcingHookFunction<S>> afterHooks = new ArrayList<>();
    private Supplier<S> initialStateSupplier;
    private ObjectMapper objectMapper = new ObjectMapper();
    private Clock clock = Clock.systemUTC();

    public AggregatorRuntimeBuilder(String name, Class<S> stateClass) {
        this.name = name;
        this.stateClass = stateClass;
        this.validator = new AggregatorValidator(name);
    }

    public static <S> AggregatorRuntimeBuilder<S> builder(String name, Class<S> stateClass) {
        return new AggregatorRuntimeBuilder<>(name, stateClass);
    }

    public AggregatorRuntimeBuilder<S> withInitialState(Supplier<S> initialStateSupplier) {
        this.initialStateSupplier = initialStateSupplier;
        return this;
    }

    public AggregatorRuntimeBuilder<S> withObjectMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        return this;
    }

    public AggregatorRuntimeBuilder<S> withClock(Clock clock) {
        this.clock = clock;
        return this;
    }

    public <E extends DomainEvent> AggregatorRuntimeBuilder<S> withEventSourcingHandler(Class<E> eventClass,
                                                                                         EventSourcingHandlerFunction<S, E> handler) {
        return withEventSourcingHandler(DomainEventType.of(eventClass), handler);
    }

    @SuppressWarnings("unchecked")
    public <E extends DomainEvent> AggregatorRuntimeBuilder<S> withEventSourcingHandler(DomainEventType<E> eventType,
                                                                                         EventSourcingHandlerFunction<S, E> handler) {
        validator.detectEventSourcingHandler(eventType);
        domainEventTypes.putIfAbsent(eventType.typeName(), eventType);
        eventSourcingHandlers.putIfAbsent(eventType.typeName(), (EventSourcingHandlerFunction<S, DomainEvent>) handler);
        return this;
    }

    public AggregatorRuntimeBuilder<S> withBeforeHook(EventSourcingHookFunction<S> hook) {
        beforeHooks.add(hook);
        return this;
    }

    public AggregatorRuntimeBuilder<S> withAfterHook(EventSourcingHookFunction<S> hook) {
        afterHooks.add(hook);
        return this;
    }

    public AggregatorRuntimeBuilder<S> withRequiredEvent(Class<? extends DomainEvent> eventClass) {
        validator.detectRequiredEvent(eventClass);
        return this;
    }

    public AggregatorRuntime<S> build() {
        if (initialStateSupplier == null) {
            throw new IllegalStateException("No initial state configured for aggregator " + name);
        }
        validator.validate();
        return new AggregatorRuntime<>(
                name,
                stateClass,
                initialStateSupplier,
                domainEventTypes,
                eventSourcingHandlers,
                beforeHooks,
                afterHooks,
                objectMapper,
                clock);
    }
}
