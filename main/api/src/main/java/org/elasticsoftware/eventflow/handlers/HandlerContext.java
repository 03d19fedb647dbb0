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

package org.elasticsoftware.eventflow.handlers;

import org.elasticsoftware.eventflow.events.DomainEvent;

import java.util.Map;

public interface HandlerContext<S> {
    String streamId();

    S state();

    /**
     * Sequence number of the last event applied to {@link #state()}, 0 for a new stream.
     */
    long version();

    /**
     * 1 for the first attempt, incremented on every reload.
     */
    int attempt();

    Map<String, Object> metadata();

    void append(DomainEvent event);

    default void publish(Object payload) {
        publish(null, streamId(), payload);
    }

    void publish(String topic, String key, Object payload);
}
