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
import org.elasticsoftware.eventflow.protocol.DomainEventRecord;
import org.elasticsoftware.eventflow.protocol.PayloadEncoding;
import org.elasticsoftware.eventflow.protocol.SnapshotRecord;
import org.elasticsoftware.eventflow.protocol.UncommittedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Dispatch table from event type tag to event sourcing handler for one aggregator. Built once by
 * {@link AggregatorRuntimeBuilder} and immutable afterwards.
 */
public final class AggregatorRuntime<S> {
    private static final Logger logger = LoggerFactory.getLogger(AggregatorRuntime.class);
    private final String name;
    private final Class<S> stateClass;
    private final Supplier<S> initialStateSupplier;
    private final Map<String, DomainEventType<?>> domainEventTypes;
    private final Map<String, EventSourcingHandlerFunction<S, DomainEvent>> eventSourcingHandlers;
    private final List<EventSourcingHookFunction<S>> beforeHooks;
    private final List<EventSourcingHookFunction<S>> afterHooks;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    AggregatorRuntime(String name,
                      Class<S> stateClass,
                      Supplier<S> initialStateSupplier,
                      Map<String, DomainEventType<?>> domainEventTypes,
                      Map<String, EventSourcingHandlerFunction<S, DomainEvent>> eventSourcingHandlers,
                      List<EventSourcingHookFunction<S>> beforeHooks,
                      List<EventSourcingHookFunction<S>> afterHooks,
                      ObjectMapper objectMapper,
                      Clock clock) {
        this.name = name;
        this.stateClass = stateClass;
        this.initialStateSupplier = initialStateSupplier;
        this.domainEventTypes = Map.copyOf(domainEventTypes);
        this.eventSourcingHandlers = Map.copyOf(eventSourcingHandlers);
        this.beforeHooks = List.copyOf(beforeHooks);
        this.afterHooks = List.copyOf(afterHooks);
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public String getName() {
        return name;
    }

    public Class<S> getStateClass() {
        return stateClass;
    }

    public S initialState() {
        S state = initialStateSupplier.get();
        if (state == null) {
            throw new IllegalStateException("Aggregator " + name + " returned a null initial state");
        }
        return state;
    }

    public boolean canApply(String type) {
        return eventSourcingHandlers.containsKey(type);
    }

    /**
     * Applies one committed event and returns the next state. Events without a handler leave the
     * state untouched and do not trigger the before and after hooks.
     */
    public S apply(DomainEventRecord eventRecord, S state) throws IOException {
        EventSourcingHandlerFunction<S, DomainEvent> handler = eventSourcingHandlers.get(eventRecord.type());
        if (handler == null) {
            logger.trace("No handler for {} in {}, skipping event {} of stream {}",
                    eventRecord.type(), name, eventRecord.sequenceNumber(), eventRecord.streamId());
            return state;
        }
        DomainEvent event = materialize(eventRecord);
        for (EventSourcingHookFunction<S> hook : beforeHooks) {
            hook.accept(event, state);
        }
        S nextState = handler.apply(event, state);
        if (nextState == null) {
            nextState = state;
        }
        for (EventSourcingHookFunction<S> hook : afterHooks) {
            hook.accept(event, nextState);
        }
        return nextState;
    }

    public UncommittedEvent toUncommitted(DomainEvent event) throws IOException {
        DomainEventType<?> type = DomainEventType.of(event.getClass());
        return new UncommittedEvent(
                type.typeName(),
                type.version(),
                objectMapper.writeValueAsBytes(event),
                PayloadEncoding.JSON,
                clock.millis());
    }

    public SnapshotRecord toSnapshot(String streamId, long sequenceNumber, S state) throws IOException {
        return new SnapshotRecord(
                streamId,
                sequenceNumber,
                name,
                1,
                objectMapper.writeValueAsBytes(state),
                PayloadEncoding.JSON);
    }

    public S materializeState(SnapshotRecord snapshotRecord) throws IOException {
        if (!name.equals(snapshotRecord.type())) {
            throw new IOException("Snapshot of type " + snapshotRecord.type() + " cannot be read by aggregator " + name);
        }
        if (snapshotRecord.encoding() != PayloadEncoding.JSON) {
            throw new IOException("Unsupported snapshot encoding " + snapshotRecord.encoding());
        }
        S state = objectMapper.readValue(snapshotRecord.payload(), stateClass);
        if (state == null) {
            throw new IOException("Snapshot payload of stream " + snapshotRecord.streamId() + " is empty");
        }
        return state;
    }

    private DomainEvent materialize(DomainEventRecord eventRecord) throws IOException {
        DomainEventType<?> type = domainEventTypes.get(eventRecord.type());
        if (eventRecord.encoding() != PayloadEncoding.JSON) {
            throw new IOException("Unsupported payload encoding " + eventRecord.encoding() + " for event " + eventRecord.type());
        }
        return objectMapper.readValue(eventRecord.payload(), type.typeClass());
    }
}
