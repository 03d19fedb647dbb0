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

import org.elasticsoftware.eventflow.events.DomainEvent;

import java.util.*;

public class AggregatorValidator {
    private final String aggregatorName;
    private final List<DomainEventType<?>> eventSourcingHandlers = new ArrayList<>();
    private final Set<Class<? extends DomainEvent>> requiredEvents = new LinkedHashSet<>();

    public AggregatorValidator(String aggregatorName) {
        this.aggregatorName = aggregatorName;
    }

    public void detectEventSourcingHandler(DomainEventType<?> eventType) {
        eventSourcingHandlers.add(eventType);
    }

    public void detectRequiredEvent(Class<? extends DomainEvent> eventClass) {
        requiredEvents.add(eventClass);
    }

    public void validate() {
        validateEventSourcingHandlers();
        validateRequiredEvents();
    }

    private void validateEventSourcingHandlers() {
        if (eventSourcingHandlers.isEmpty()) {
            throw new IllegalStateException("No event sourcing handlers registered for aggregator " + aggregatorName);
        }
        // the type tag is the dispatch key, so it has to be unique regardless of the version
        Map<String, DomainEventType<?>> seenEventTypes = new HashMap<>();
        for (DomainEventType<?> eventType : eventSourcingHandlers) {
            DomainEventType<?> previous = seenEventTypes.putIfAbsent(eventType.typeName(), eventType);
            if (previous != null) {
                throw new IllegalStateException("Duplicate event sourcing handler for event " +
                        eventType.typeName() + " version " + eventType.version() +
                        " in aggregator " + aggregatorName);
            }
        }
    }

    private void validateRequiredEvents() {
        for (Class<? extends DomainEvent> requiredEvent : requiredEvents) {
            DomainEventType<?> requiredType = DomainEventType.of(requiredEvent);
            if (eventSourcingHandlers.stream().noneMatch(h -> h.typeName().equals(requiredType.typeName()))) {
                throw new IllegalStateException("No event sourcing handler for required event " +
                        requiredType.typeName() + " in aggregator " + aggregatorName);
            }
        }
    }
}
