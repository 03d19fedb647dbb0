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

import org.elasticsoftware.eventflow.aggregate.AggregatorRuntime;
import org.elasticsoftware.eventflow.errors.ConcurrencyConflictException;
import org.elasticsoftware.eventflow.errors.MaxRetriesExceededException;
import org.elasticsoftware.eventflow.errors.MessageHandlingException;
import org.elasticsoftware.eventflow.errors.StorageUnavailableException;
import org.elasticsoftware.eventflow.aggregate.StateRef;
import org.elasticsoftware.eventflow.handlers.PublishedMessage;
import org.elasticsoftware.eventflow.loader.AggregateLoader;
import org.elasticsoftware.eventflow.protocol.SnapshotRecord;
import org.elasticsoftware.eventflow.protocol.UncommittedEvent;
import org.elasticsoftware.eventflow.snapshot.InMemorySnapshotStore;
import org.elasticsoftware.eventflow.snapshot.SnapshotPolicy;
import org.elasticsoftware.eventflow.snapshot.SnapshotStore;
import org.elasticsoftware.eventflow.store.CommitResult;
import org.elasticsoftware.eventflow.store.InMemoryEventStore;
import org.elasticsoftware.eventflowtest.counter.CounterChanged;
import org.elasticsoftware.eventflowtest.counter.CounterCommand;
import org.elasticsoftware.eventflowtest.counter.CounterCommandHandler;
import org.elasticsoftware.eventflowtest.counter.CounterFixtures;
import org.elasticsoftware.eventflowtest.counter.CounterState;
import org.elasticsoftware.eventflowtest.counter.IncrementedEvent;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.elasticsoftware.eventflowtest.counter.CounterFixtures.uncommitted;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

class DispatchLoopTest {
    private final AggregatorRuntime<CounterState> runtime = CounterFixtures.counterRuntime();
    private final List<Duration> sleeps = new ArrayList<>();

    private DispatchLoop.Builder<CounterCommand, CounterState> builder(InMemoryEventStore eventStore) {
        return DispatchLoop.<CounterCommand, CounterState>builder(runtime, eventStore)
                .withHandler(new CounterCommandHandler())
                .withSleeper(sleeps::add);
    }

    @Test
    void testSequentialMessagesForOneStream() {
        InMemoryEventStore eventStore = new InMemoryEventStore();
        DispatchLoop<CounterCommand, CounterState> loop = builder(eventStore).build();

        DispatchResult<CounterState> first = loop.dispatch("123", new CounterCommand(5));
        DispatchResult<CounterState> second = loop.dispatch("123", new CounterCommand(3));

        assertEquals(1L, first.version());
        assertEquals(5L, first.state().total());
        assertEquals(2L, second.version());
        assertEquals(8L, second.state().total());
        assertEquals(1, second.attempts());
        assertEquals(1, second.committedEvents().size());
        assertEquals(2L, second.committedEvents().get(0).sequenceNumber());
        assertEquals(List.of(new PublishedMessage(null, "123", new CounterChanged("123", 8L))), second.publishedMessages());
        assertEquals(2L, eventStore.currentVersion("123"));
    }

    @Test
    void testMessageWithoutEventsCommitsNothing() {
        InMemoryEventStore eventStore = new InMemoryEventStore();
        DispatchLoop<CounterCommand, CounterState> loop = builder(eventStore).build();
        loop.dispatch("123", new CounterCommand(5));

        DispatchResult<CounterState> result = loop.dispatch("123", new CounterCommand(0));

        assertEquals(1L, result.version());
        assertEquals(5L, result.state().total());
        assertTrue(result.committedEvents().isEmpty());
        assertTrue(result.publishedMessages().isEmpty());
        assertEquals(1L, eventStore.currentVersion("123"));
    }

    @Test
    void testConflictReloadsAndRunsHandlerAgain() {
        InterferingEventStore eventStore = new InterferingEventStore(1);
        AtomicInteger invocations = new AtomicInteger();
        DispatchLoop<CounterCommand, CounterState> loop = builder(eventStore)
                .withHandler((command, context) -> {
                    invocations.incrementAndGet();
                    new CounterCommandHandler().handle(command, context);
                })
                .build();

        DispatchResult<CounterState> result = loop.dispatch("123", new CounterCommand(5));

        assertEquals(2, invocations.get());
        assertEquals(2, result.attempts());
        assertEquals(2L, result.version());
        // the concurrent writer added 100 before our 5
        assertEquals(105L, result.state().total());
        // only the messages of the committed attempt are released
        assertEquals(List.of(new PublishedMessage(null, "123", new CounterChanged("123", 105L))), result.publishedMessages());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void testConflictRetriesAreBounded() {
        InterferingEventStore eventStore = new InterferingEventStore(Integer.MAX_VALUE);
        DispatchLoop<CounterCommand, CounterState> loop = builder(eventStore)
                .withRetryPolicy(RetryPolicy.DEFAULT.withMaxConflictRetries(3))
                .build();

        MaxRetriesExceededException exception = assertThrows(MaxRetriesExceededException.class,
                () -> loop.dispatch("123", new CounterCommand(5)));

        assertEquals("123", exception.getStreamId());
        assertEquals(4, exception.getAttempts());
        assertInstanceOf(ConcurrencyConflictException.class, exception.getCause());
        // nothing of ours was appended
        assertEquals(4L, eventStore.currentVersion("123"));
    }

    @Test
    void testUnavailableStoreBacksOffAndRetries() {
        UnavailableEventStore eventStore = new UnavailableEventStore(2);
        DispatchLoop<CounterCommand, CounterState> loop = builder(eventStore).build();

        DispatchResult<CounterState> result = loop.dispatch("123", new CounterCommand(5));

        assertEquals(3, result.attempts());
        assertEquals(5L, result.state().total());
        assertEquals(List.of(Duration.ofMillis(50), Duration.ofMillis(100)), sleeps);
    }

    @Test
    void testUnavailableStoreFailsAfterStorageRetries() {
        UnavailableEventStore eventStore = new UnavailableEventStore(Integer.MAX_VALUE);
        DispatchLoop<CounterCommand, CounterState> loop = builder(eventStore).build();

        assertThrows(StorageUnavailableException.class, () -> loop.dispatch("123", new CounterCommand(5)));
        assertEquals(3, sleeps.size());
        assertEquals(0L, eventStore.currentVersion("123"));
    }

    @Test
    void testHandlerFailureIsNotRetried() {
        AtomicInteger invocations = new AtomicInteger();
        DispatchLoop<CounterCommand, CounterState> loop = builder(new InMemoryEventStore())
                .withHandler((command, context) -> {
                    invocations.incrementAndGet();
                    throw new IllegalArgumentException("invalid command");
                })
                .build();

        MessageHandlingException exception = assertThrows(MessageHandlingException.class,
                () -> loop.dispatch("123", new CounterCommand(5)));

        assertEquals(1, invocations.get());
        assertInstanceOf(IllegalArgumentException.class, exception.getCause());
    }

    @Test
    void testHandlerSeesAttemptAndMetadata() {
        List<Object> seen = new ArrayList<>();
        DispatchLoop<CounterCommand, CounterState> loop = builder(new InMemoryEventStore())
                .withHandler((command, context) -> {
                    seen.add(context.attempt());
                    seen.add(context.metadata().get("topic"));
                    seen.add(context.version());
                })
                .build();

        loop.dispatch("123", new CounterCommand(1), Map.of("topic", "counters"));

        assertEquals(List.of(1, "counters", 0L), seen);
    }

    @Test
    void testStreamingModeAppendsWithoutVersionCheck() {
        InterferingEventStore eventStore = new InterferingEventStore(1);
        DispatchLoop<CounterCommand, CounterState> loop = builder(eventStore)
                .withCommitMode(CommitMode.STREAMING)
                .build();

        DispatchResult<CounterState> result = loop.dispatch("123", new CounterCommand(5));

        assertEquals(1, result.attempts());
        assertEquals(1L, result.version());
        assertEquals(5L, result.state().total());
        // the conditional append was never used
        assertEquals(1, eventStore.interferences);
    }

    @Test
    void testStreamingCommitReplaysEventsAppendedConcurrently() {
        InMemorySnapshotStore snapshotStore = new InMemorySnapshotStore();
        InMemoryEventStore eventStore = new InMemoryEventStore() {
            private boolean interfered;

            @Override
            public CommitResult appendUnconditionally(String streamId, List<UncommittedEvent> events) {
                if (!interfered) {
                    interfered = true;
                    super.appendUnconditionally(streamId, uncommitted(runtime, new IncrementedEvent(100)));
                }
                return super.appendUnconditionally(streamId, events);
            }
        };
        DispatchLoop<CounterCommand, CounterState> loop = builder(eventStore)
                .withCommitMode(CommitMode.STREAMING)
                .withSnapshotStore(snapshotStore)
                .withSnapshotPolicy(SnapshotPolicy.everyEvents(1))
                .build();

        DispatchResult<CounterState> result = loop.dispatch("123", new CounterCommand(5));

        StateRef<CounterState> replayed = new AggregateLoader<>(runtime, eventStore).load("123");
        assertEquals(2L, result.version());
        assertEquals(105L, result.state().total());
        assertEquals(replayed.state(), result.state());
        assertEquals(replayed.version(), result.version());
        // only our own event is reported as committed
        assertEquals(1, result.committedEvents().size());
        assertEquals(2L, result.committedEvents().get(0).sequenceNumber());
        SnapshotRecord snapshot = snapshotStore.latest("123").orElseThrow();
        assertEquals(2L, snapshot.sequenceNumber());
        assertEquals(new CounterState(105L), assertDoesNotThrow(() -> runtime.materializeState(snapshot)));
    }

    @Test
    void testSnapshotIsWrittenAfterCommit() {
        InMemorySnapshotStore snapshotStore = new InMemorySnapshotStore();
        DispatchLoop<CounterCommand, CounterState> loop = builder(new InMemoryEventStore())
                .withSnapshotStore(snapshotStore)
                .withSnapshotPolicy(SnapshotPolicy.everyEvents(2))
                .build();

        loop.dispatch("123", new CounterCommand(5));
        assertTrue(snapshotStore.latest("123").isEmpty());
        loop.dispatch("123", new CounterCommand(3));

        SnapshotRecord snapshot = snapshotStore.latest("123").orElseThrow();
        assertEquals(2L, snapshot.sequenceNumber());
        assertEquals(new CounterState(8L), assertDoesNotThrow(() -> runtime.materializeState(snapshot)));
    }

    @Test
    void testSnapshotFailureDoesNotFailTheMessage() {
        SnapshotStore snapshotStore = mock(SnapshotStore.class);
        doThrow(new StorageUnavailableException("123", "down")).when(snapshotStore).put(any());
        DispatchLoop<CounterCommand, CounterState> loop = builder(new InMemoryEventStore())
                .withSnapshotStore(snapshotStore)
                .withSnapshotPolicy(SnapshotPolicy.everyEvents(1))
                .build();

        DispatchResult<CounterState> result = loop.dispatch("123", new CounterCommand(5));

        assertEquals(1L, result.version());
    }

    @Test
    void testConcurrentWritersOnOneStreamAllSucceed() throws Exception {
        InMemoryEventStore eventStore = new InMemoryEventStore();
        DispatchLoop<CounterCommand, CounterState> loop = builder(eventStore)
                .withRetryPolicy(RetryPolicy.DEFAULT.withMaxConflictRetries(Integer.MAX_VALUE))
                .build();
        int writers = 4;
        int messagesPerWriter = 25;
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                futures.add(executor.submit(() -> {
                    for (int j = 0; j < messagesPerWriter; j++) {
                        loop.dispatch("123", new CounterCommand(1));
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        DispatchResult<CounterState> result = loop.dispatch("123", new CounterCommand(0));
        assertEquals(writers * messagesPerWriter, result.version());
        assertEquals(writers * messagesPerWriter, result.state().total());
    }

    @Test
    void testDispatchesForOneStreamAreSerialized() throws Exception {
        InMemoryEventStore eventStore = new InMemoryEventStore();
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        DispatchLoop<CounterCommand, CounterState> loop = builder(eventStore)
                .withRetryPolicy(RetryPolicy.DEFAULT.withMaxConflictRetries(0))
                .withHandler((command, context) -> {
                    maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                    Thread.sleep(2);
                    new CounterCommandHandler().handle(command, context);
                    inFlight.decrementAndGet();
                })
                .build();
        int writers = 4;
        int messagesPerWriter = 10;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int j = 0; j < messagesPerWriter; j++) {
                        loop.dispatch("123", new CounterCommand(1));
                    }
                    return null;
                }));
            }
            start.countDown();
            // a conflict would fail the dispatch since no conflict retries are allowed
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, maxInFlight.get());
        assertEquals(writers * messagesPerWriter, eventStore.currentVersion("123"));
    }

    @Test
    void testDifferentStreamsAreDispatchedInParallel() throws Exception {
        CountDownLatch bothStarted = new CountDownLatch(2);
        DispatchLoop<CounterCommand, CounterState> loop = builder(new InMemoryEventStore())
                .withLockStripes(1024)
                .withHandler((command, context) -> {
                    bothStarted.countDown();
                    if (!bothStarted.await(10, TimeUnit.SECONDS)) {
                        throw new IllegalStateException("streams were serialized");
                    }
                    new CounterCommandHandler().handle(command, context);
                })
                .build();
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            // "a" and "b" hash to different stripes
            Future<DispatchResult<CounterState>> first = executor.submit(() -> loop.dispatch("a", new CounterCommand(1)));
            Future<DispatchResult<CounterState>> second = executor.submit(() -> loop.dispatch("b", new CounterCommand(2)));

            assertEquals(1L, first.get(30, TimeUnit.SECONDS).state().total());
            assertEquals(2L, second.get(30, TimeUnit.SECONDS).state().total());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testLockStripesMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> builder(new InMemoryEventStore()).withLockStripes(0));
    }

    /**
     * Lets another writer append an event right before each of the first {@code interferences} appends.
     */
    private class InterferingEventStore extends InMemoryEventStore {
        private int interferences;

        InterferingEventStore(int interferences) {
            this.interferences = interferences;
        }

        @Override
        public CommitResult append(String streamId, long expectedVersion, List<UncommittedEvent> events) {
            if (interferences > 0) {
                interferences--;
                super.appendUnconditionally(streamId, uncommitted(runtime, new IncrementedEvent(100)));
            }
            return super.append(streamId, expectedVersion, events);
        }
    }

    private static class UnavailableEventStore extends InMemoryEventStore {
        private int failures;

        UnavailableEventStore(int failures) {
            this.failures = failures;
        }

        @Override
        public CommitResult append(String streamId, long expectedVersion, List<UncommittedEvent> events) {
            if (failures > 0) {
                failures--;
                return new CommitResult.Unavailable(new StorageUnavailableException(streamId, "store down"));
            }
            return super.append(streamId, expectedVersion, events);
        }
    }
}
