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

import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.eventflow.annotations.AggregatorInfo;

/**
 * A set of event sourcing handlers that fold the events of a stream into a state of type {@code S}.
 * Handlers run both during replay and after a live append, so they must be a pure function of
 * the event and the current state.
 */
public interface Aggregator<S> {
    default String getName() {
        AggregatorInfo info = getClass().getAnnotation(AggregatorInfo.class);
        return info != null ? info.value() : getClass().getSimpleName();
    }

    Class<S> getStateClass();

    /**
     * Called once per load, the returned instance must not be shared between streams.
     */
    @NotNull S initialState();
}
