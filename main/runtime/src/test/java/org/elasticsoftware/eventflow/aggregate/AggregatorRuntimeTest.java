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
import org.elasticsoftware.eventflow.protocol.DomainEventRecord;
import org.elasticsoftware.eventflow.protocol.PayloadEncoding;
import org.elasticsoftware.eventflow.protocol.SnapshotRecord;
import org.elasticsoftware.eventflow.protocol.UncommittedEvent;
import org.elasticsoftware.eventflowtest.counter.CounterState;
import org.elasticsoftware.eventflowtest.counter.IncrementedEvent;
import org.elasticsoftware.eventflowtest.counter.ResetEvent;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class AggregatorRuntimeTest {
    private final Clock clock = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);

    private AggregatorRuntime<CounterState> runtime() {
        return AggregatorRuntimeBuilder.builder("Counter", CounterState.class)
                .withInitialState(() -> new CounterState(0L))
                .withObjectMapper(new ObjectMapper())
                .withClock(clock)
                .withEventSourcingHandler(IncrementedEvent.class,
                        (event, state) -> new CounterState(state.total() + event.amount()))
                .build();
    }

    @Test
    void testToUncommittedUsesTypeTagAndClock() throws IOException {
        UncommittedEvent uncommitted = runtime().toUncommitted(new IncrementedEvent(3));

        assertEquals("Incremented", uncommitted.type());
        assertEquals(1, uncommitted.version());
        assertEquals(PayloadEncoding.JSON, uncommitted.encoding());
        assertEquals(1_700_000_000_000L, uncommitted.timestamp());
        assertEquals("{\"amount\":3}", new String(uncommitted.payload(), StandardCharsets.UTF_8));
    }

    @Test
    void testUnknownEventTypeIsSkipped() throws IOException {
        AggregatorRuntime<CounterState> runtime = runtime();
        CounterState state = new CounterState(42L);
        DomainEventRecord reset = runtime.toUncommitted(new ResetEvent("manual")).toRecord("counter-1", 1L);

        assertSame(state, runtime.apply(reset, state));
    }

    @Test
    void testNullReturnKeepsState() throws IOException {
        AggregatorRuntime<CounterState> runtime = AggregatorRuntimeBuilder.builder("Counter", CounterState.class)
                .withInitialState(() -> new CounterState(0L))
                .withEventSourcingHandler(IncrementedEvent.class, (event, state) -> null)
                .build();
        CounterState state = new CounterState(1L);
        DomainEventRecord incremented = runtime.toUncommitted(new IncrementedEvent(1)).toRecord("counter-1", 1L);

        assertSame(state, runtime.apply(incremented, state));
    }

    @Test
    void testUnsupportedEncodingFails() {
        DomainEventRecord binary = new DomainEventRecord("counter-1", 1L, "Incremented", 1,
                new byte[]{1, 2}, PayloadEncoding.BYTES, 0L);

        assertThrows(IOException.class, () -> runtime().apply(binary, new CounterState(0L)));
    }

    @Test
    void testSnapshotRoundTrip() throws IOException {
        AggregatorRuntime<CounterState> runtime = runtime();
        SnapshotRecord snapshot = runtime.toSnapshot("counter-1", 12L, new CounterState(99L));

        assertEquals("Counter", snapshot.type());
        assertEquals(12L, snapshot.sequenceNumber());
        assertEquals(new CounterState(99L), runtime.materializeState(snapshot));
    }

    @Test
    void testSnapshotOfOtherAggregatorIsRejected() {
        SnapshotRecord foreign = new SnapshotRecord("counter-1", 3L, "Wallet", 1,
                "{\"total\":1}".getBytes(StandardCharsets.UTF_8), PayloadEncoding.JSON);

        assertThrows(IOException.class, () -> runtime().materializeState(foreign));
    }

    @Test
    void testBuildWithoutInitialStateFails() {
        AggregatorRuntimeBuilder<CounterState> builder = AggregatorRuntimeBuilder.builder("Counter", CounterState.class)
                .withEventSourcingHandler(IncrementedEvent.class, (event, state) -> state);

        assertThrows(IllegalStateException.class, builder::build);
    }

    @Test
    void testBuildWithoutHandlersFails() {
        AggregatorRuntimeBuilder<CounterState> builder = AggregatorRuntimeBuilder.builder("Counter", CounterState.class)
                .withInitialState(() -> new CounterState(0L));

        assertThrows(IllegalStateException.class, builder::build);
    }

    @Test
    void testNullInitialStateFails() {
        AggregatorRuntime<CounterState> runtime = AggregatorRuntimeBuilder.builder("Counter", CounterState.class)
                .withInitialState(() -> null)
                .withEventSourcingHandler(IncrementedEvent.class, (event, state) -> state)
                .build();

        assertThrows(IllegalStateException.class, runtime::initialState);
    }

    @Test
    void testEventClassWithoutAnnotationIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> DomainEventType.of(UnannotatedEvent.class));
    }

    record UnannotatedEvent(int amount) implements org.elasticsoftware.eventflow.events.DomainEvent {
    }
}
