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

package org.elasticsoftware.eventflowtest.counter;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.elasticsoftware.eventflow.aggregate.AggregatorRuntime;
import org.elasticsoftware.eventflow.beans.AggregatorScanner;
import org.elasticsoftware.eventflow.events.DomainEvent;
import org.elasticsoftware.eventflow.protocol.UncommittedEvent;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

public final class CounterFixtures {
    public static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private CounterFixtures() {
    }

    public static AggregatorRuntime<CounterState> counterRuntime() {
        return AggregatorScanner.scan(new CounterAggregator(), OBJECT_MAPPER);
    }

    public static List<UncommittedEvent> uncommitted(AggregatorRuntime<CounterState> runtime, DomainEvent... events) {
        List<UncommittedEvent> result = new ArrayList<>();
        for (DomainEvent event : events) {
            try {
                result.add(runtime.toUncommitted(event));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
        return result;
    }
}
