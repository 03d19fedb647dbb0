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

package org.elasticsoftware.eventflow.dispatch;

import org.elasticsoftware.eventflow.aggregate.StateRef;
import org.elasticsoftware.eventflow.events.DomainEvent;
import org.elasticsoftware.eventflow.handlers.HandlerContext;
import org.elasticsoftware.eventflow.handlers.PublishedMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

final class DefaultHandlerContext<S> implements HandlerContext<S> {
    private final StateRef<S> stateRef;
    private final int attempt;
    private final Map<String, Object> metadata;
    private final List<DomainEvent> appendedEvents = new ArrayList<>();
    private final List<PublishedMessage> publishedMessages = new ArrayList<>();

    DefaultHandlerContext(StateRef<S> stateRef, int attempt, Map<String, Object> metadata) {
        this.stateRef = stateRef;
        this.attempt = attempt;
        this.metadata = metadata;
    }

    @Override
    public String streamId() {
        return stateRef.streamId();
    }

    @Override
    public S state() {
        return stateRef.state();
    }

    @Override
    public long version() {
        return stateRef.version();
    }

    @Override
    public int attempt() {
        return attempt;
    }

    @Override
    public Map<String, Object> metadata() {
        return metadata;
    }

    @Override
    public void append(DomainEvent event) {
        appendedEvents.add(Objects.requireNonNull(event, "event"));
    }

    @Override
    public void publish(String topic, String key, Object payload) {
        publishedMessages.add(new PublishedMessage(topic, key, Objects.requireNonNull(payload, "payload")));
    }

    List<DomainEvent> getAppendedEvents() {
        return appendedEvents;
    }

    List<PublishedMessage> getPublishedMessages() {
        return publishedMessages;
    }
}
