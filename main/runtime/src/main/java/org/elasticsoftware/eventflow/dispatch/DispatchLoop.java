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

import com.google.common.util.concurrent.Striped;
import org.elasticsoftware.eventflow.EventFlowException;
import org.elasticsoftware.eventflow.aggregate.AggregatorRuntime;
import org.elasticsoftware.eventflow.aggregate.StateRef;
import org.elasticsoftware.eventflow.errors.ConcurrencyConflictException;
import org.elasticsoftware.eventflow.errors.EventStoreException;
import org.elasticsoftware.eventflow.errors.MaxRetriesExceededException;
import org.elasticsoftware.eventflow.errors.MessageHandlingException;
import org.elasticsoftware.eventflow.errors.StorageUnavailableException;
import org.elasticsoftware.eventflow.events.DomainEvent;
import org.elasticsoftware.eventflow.handlers.MessageHandler;
import org.elasticsoftware.eventflow.loader.AggregateLoader;
import org.elasticsoftware.eventflow.protocol.DomainEventRecord;
import org.elasticsoftware.eventflow.protocol.UncommittedEvent;
import org.elasticsoftware.eventflow.snapshot.SnapshotPolicy;
import org.elasticsoftware.eventflow.snapshot.SnapshotStore;
import org.elasticsoftware.eventflow.store.CommitResult;
import org.elasticsoftware.eventflow.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.Lock;

/**
 * Runs one message through LOADING, HANDLING and COMMITTING until the events the handler declared are
 * committed. A version conflict reloads the stream and runs the handler again, an unavailable store
 * backs off first. Both are bounded by the {@link RetryPolicy}.
 * <p>
 * Dispatches for the same stream are serialized on a striped lock, so one loop can be shared by
 * several threads (for instance one per Kafka partition). Ordering between those threads is not
 * defined, use {@link PartitionedDispatcher} when messages for a stream must run in submission order.
 */
public class DispatchLoop<M, S> {
    private static final Logger logger = LoggerFactory.getLogger(DispatchLoop.class);
    private final AggregatorRuntime<S> runtime;
    private final EventStore eventStore;
    private final SnapshotStore snapshotStore;
    private final AggregateLoader<S> loader;
    private final MessageHandler<M, S> handler;
    private final CommitMode commitMode;
    private final RetryPolicy retryPolicy;
    private final SnapshotPolicy snapshotPolicy;
    private final Sleeper sleeper;
    private final Striped<Lock> streamLocks;

    private DispatchLoop(Builder<M, S> builder) {
        this.runtime = Objects.requireNonNull(builder.runtime, "runtime");
        this.eventStore = Objects.requireNonNull(builder.eventStore, "eventStore");
        this.snapshotStore = builder.snapshotStore;
        this.handler = Objects.requireNonNull(builder.handler, "handler");
        this.commitMode = builder.commitMode;
        this.retryPolicy = builder.retryPolicy;
        this.snapshotPolicy = builder.snapshotPolicy;
        this.sleeper = builder.sleeper;
        this.streamLocks = Striped.lazyWeakLock(builder.lockStripes);
        this.loader = new AggregateLoader<>(runtime, eventStore, snapshotStore);
    }

    public static <M, S> Builder<M, S> builder(AggregatorRuntime<S> runtime, EventStore eventStore) {
        return new Builder<>(runtime, eventStore);
    }

    public String getAggregatorName() {
        return runtime.getName();
    }

    public DispatchResult<S> dispatch(String streamId, M message) {
        return dispatch(streamId, message, Map.of());
    }

    /**
     * @throws MaxRetriesExceededException when the conflict retries are exhausted
     * @throws StorageUnavailableException when the store stays unavailable after the storage retries,
     *                                     or cannot be read while loading
     * @throws MessageHandlingException    when the handler fails, this is never retried
     */
    public DispatchResult<S> dispatch(String streamId, M message, Map<String, Object> metadata) {
        Objects.requireNonNull(streamId, "streamId");
        Lock streamLock = streamLocks.get(streamId);
        streamLock.lock();
        try {
            return runDispatch(streamId, message, metadata);
        } finally {
            streamLock.unlock();
        }
    }

    private DispatchResult<S> runDispatch(String streamId, M message, Map<String, Object> metadata) {
        DispatchState dispatchState = DispatchState.LOADING;
        int attempt = 0;
        int conflicts = 0;
        int storageFailures = 0;
        StateRef<S> stateRef = null;
        DefaultHandlerContext<S> context = null;
        List<UncommittedEvent> uncommitted = List.of();
        DispatchResult<S> result = null;
        while (dispatchState != DispatchState.DONE) {
            if (dispatchState == DispatchState.LOADING) {
                attempt++;
                stateRef = loader.load(streamId);
                dispatchState = DispatchState.HANDLING;
            } else if (dispatchState == DispatchState.HANDLING) {
                context = new DefaultHandlerContext<>(stateRef, attempt, metadata);
                handle(streamId, message, context);
                if (context.getAppendedEvents().isEmpty()) {
                    result = new DispatchResult<>(streamId, stateRef.state(), stateRef.version(),
                            List.of(), List.copyOf(context.getPublishedMessages()), attempt);
                    dispatchState = DispatchState.DONE;
                } else {
                    uncommitted = serialize(streamId, context.getAppendedEvents());
                    dispatchState = DispatchState.COMMITTING;
                }
            } else if (dispatchState == DispatchState.COMMITTING) {
                CommitResult commitResult = commit(streamId, stateRef.version(), uncommitted);
                if (commitResult instanceof CommitResult.Committed committed) {
                    result = onCommitted(stateRef, committed, context, attempt);
                    dispatchState = DispatchState.DONE;
                } else if (commitResult instanceof CommitResult.Conflict conflict) {
                    conflicts++;
                    if (conflicts > retryPolicy.maxConflictRetries()) {
                        throw new MaxRetriesExceededException(streamId, attempt, new ConcurrencyConflictException(
                                streamId, conflict.expectedVersion(), conflict.actualVersion()));
                    }
                    logger.debug("Conflict on stream {}: expected version {} but found {}, reloading (retry {}/{})",
                            streamId, conflict.expectedVersion(), conflict.actualVersion(),
                            conflicts, retryPolicy.maxConflictRetries());
                    dispatchState = DispatchState.LOADING;
                } else if (commitResult instanceof CommitResult.Unavailable unavailable) {
                    storageFailures++;
                    if (storageFailures > retryPolicy.maxStorageRetries()) {
                        throw unavailable.cause();
                    }
                    logger.warn("Store unavailable while committing to stream {}, retry {}/{}",
                            streamId, storageFailures, retryPolicy.maxStorageRetries(), unavailable.cause());
                    backoff(storageFailures, unavailable.cause());
                    dispatchState = DispatchState.LOADING;
                }
            }
        }
        return result;
    }

    private void handle(String streamId, M message, DefaultHandlerContext<S> context) {
        try {
            handler.handle(message, context);
        } catch (EventFlowException e) {
            throw e;
        } catch (Exception e) {
            throw new MessageHandlingException(streamId, e);
        }
    }

    private List<UncommittedEvent> serialize(String streamId, List<DomainEvent> events) {
        List<UncommittedEvent> uncommitted = new ArrayList<>(events.size());
        for (DomainEvent event : events) {
            try {
                uncommitted.add(runtime.toUncommitted(event));
            } catch (IOException | IllegalArgumentException e) {
                throw new MessageHandlingException(streamId, e);
            }
        }
        return uncommitted;
    }

    private CommitResult commit(String streamId, long expectedVersion, List<UncommittedEvent> events) {
        return switch (commitMode) {
            case EVENT_SOURCED -> eventStore.append(streamId, expectedVersion, events);
            case STREAMING -> eventStore.appendUnconditionally(streamId, events);
        };
    }

    private DispatchResult<S> onCommitted(StateRef<S> stateRef,
                                          CommitResult.Committed committed,
                                          DefaultHandlerContext<S> context,
                                          int attempt) {
        String streamId = stateRef.streamId();
        // in streaming mode other writers may have appended in between, those events are replayed too
        boolean contiguous = committed.newVersion() == stateRef.version() + committed.records().size();
        List<DomainEventRecord> toApply = contiguous
                ? committed.records()
                : eventsUpTo(streamId, stateRef.version(), committed.newVersion());
        S state = stateRef.state();
        long expectedSequenceNumber = stateRef.version() + 1;
        for (DomainEventRecord eventRecord : toApply) {
            if (eventRecord.sequenceNumber() != expectedSequenceNumber) {
                throw new EventStoreException("Gap in stream " + streamId + ": expected sequence number " +
                        expectedSequenceNumber + " but found " + eventRecord.sequenceNumber(), null);
            }
            try {
                state = runtime.apply(eventRecord, state);
            } catch (IOException e) {
                throw new EventStoreException("Unreadable event " + eventRecord.type() + " committed to stream " +
                        streamId, e);
            }
            expectedSequenceNumber++;
        }
        if (expectedSequenceNumber - 1 != committed.newVersion()) {
            throw new EventStoreException("Stream " + streamId + " ended at sequence number " +
                    (expectedSequenceNumber - 1) + " but the commit reported version " + committed.newVersion(), null);
        }
        logger.trace("Committed {} events to stream {}, now at version {}",
                committed.records().size(), streamId, committed.newVersion());
        if (snapshotPolicy.shouldSnapshot(stateRef.version(), committed.newVersion())) {
            writeSnapshot(streamId, committed.newVersion(), state);
        }
        return new DispatchResult<>(streamId, state, committed.newVersion(), committed.records(),
                List.copyOf(context.getPublishedMessages()), attempt);
    }

    private List<DomainEventRecord> eventsUpTo(String streamId, long afterSequenceNumber, long lastSequenceNumber) {
        logger.debug("Stream {} was appended to concurrently, replaying events {} to {}",
                streamId, afterSequenceNumber + 1, lastSequenceNumber);
        return eventStore.getEvents(streamId, afterSequenceNumber).stream()
                .filter(eventRecord -> eventRecord.sequenceNumber() <= lastSequenceNumber)
                .toList();
    }

    private void writeSnapshot(String streamId, long sequenceNumber, S state) {
        try {
            snapshotStore.put(runtime.toSnapshot(streamId, sequenceNumber, state));
        } catch (IOException | StorageUnavailableException e) {
            logger.warn("Unable to write snapshot for stream {} at version {}", streamId, sequenceNumber, e);
        }
    }

    private void backoff(int retry, StorageUnavailableException cause) {
        try {
            sleeper.sleep(retryPolicy.backoff(retry));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw cause;
        }
    }

    public static final class Builder<M, S> {
        private final AggregatorRuntime<S> runtime;
        private final EventStore eventStore;
        private SnapshotStore snapshotStore = SnapshotStore.none();
        private MessageHandler<M, S> handler;
        private CommitMode commitMode = CommitMode.EVENT_SOURCED;
        private RetryPolicy retryPolicy = RetryPolicy.DEFAULT;
        private SnapshotPolicy snapshotPolicy = SnapshotPolicy.never();
        private Sleeper sleeper = Sleeper.THREAD;
        private int lockStripes = 1024;

        private Builder(AggregatorRuntime<S> runtime, EventStore eventStore) {
            this.runtime = runtime;
            this.eventStore = eventStore;
        }

        public Builder<M, S> withHandler(MessageHandler<M, S> handler) {
            this.handler = handler;
            return this;
        }

        public Builder<M, S> withSnapshotStore(SnapshotStore snapshotStore) {
            this.snapshotStore = Objects.requireNonNull(snapshotStore);
            return this;
        }

        public Builder<M, S> withSnapshotPolicy(SnapshotPolicy snapshotPolicy) {
            this.snapshotPolicy = Objects.requireNonNull(snapshotPolicy);
            return this;
        }

        public Builder<M, S> withCommitMode(CommitMode commitMode) {
            this.commitMode = Objects.requireNonNull(commitMode);
            return this;
        }

        public Builder<M, S> withRetryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = Objects.requireNonNull(retryPolicy);
            return this;
        }

        public Builder<M, S> withSleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper);
            return this;
        }

        public Builder<M, S> withLockStripes(int lockStripes) {
            if (lockStripes <= 0) {
                throw new IllegalArgumentException("Number of lock stripes must be positive, got " + lockStripes);
            }
            this.lockStripes = lockStripes;
            return this;
        }

        public DispatchLoop<M, S> build() {
            return new DispatchLoop<>(this);
        }
    }
}
