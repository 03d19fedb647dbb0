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

package org.elasticsoftware.eventflow.loader;

import org.elasticsoftware.eventflow.aggregate.AggregatorRuntime;
import org.elasticsoftware.eventflow.aggregate.StateRef;
import org.elasticsoftware.eventflow.errors.EventStoreException;
import org.elasticsoftware.eventflow.errors.SnapshotCorruptException;
import org.elasticsoftware.eventflow.errors.StorageUnavailableException;
import org.elasticsoftware.eventflow.protocol.DomainEventRecord;
import org.elasticsoftware.eventflow.protocol.SnapshotRecord;
import org.elasticsoftware.eventflow.snapshot.SnapshotStore;
import org.elasticsoftware.eventflow.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Rebuilds the state of a stream from its latest usable snapshot plus the events that follow it.
 * Anything wrong with the snapshot degrades to a full replay, only a failing event fetch is fatal.
 */
public class AggregateLoader<S> {
    private static final Logger logger = LoggerFactory.getLogger(AggregateLoader.class);
    private final AggregatorRuntime<S> runtime;
    private final EventStore eventStore;
    private final SnapshotStore snapshotStore;

    public AggregateLoader(AggregatorRuntime<S> runtime, EventStore eventStore, SnapshotStore snapshotStore) {
        this.runtime = runtime;
        this.eventStore = eventStore;
        this.snapshotStore = snapshotStore;
    }

    public AggregateLoader(AggregatorRuntime<S> runtime, EventStore eventStore) {
        this(runtime, eventStore, SnapshotStore.none());
    }

    /**
     * @throws StorageUnavailableException when the events cannot be fetched
     */
    public StateRef<S> load(String streamId) {
        Seed<S> seed = seedFromSnapshot(streamId).orElseGet(this::emptySeed);
        List<DomainEventRecord> events = eventStore.getEvents(streamId, seed.sequenceNumber());
        if (seed.fromSnapshot() && !isConsistent(streamId, seed, events)) {
            seed = emptySeed();
            events = eventStore.getEvents(streamId, 0L);
        }
        S state = seed.state();
        long version = seed.sequenceNumber();
        for (DomainEventRecord event : events) {
            if (event.sequenceNumber() != version + 1) {
                throw new EventStoreException("Gap in stream " + streamId + ": expected sequence number " +
                        (version + 1) + " but found " + event.sequenceNumber(), null);
            }
            try {
                state = runtime.apply(event, state);
            } catch (IOException e) {
                throw new EventStoreException("Unreadable event " + event.type() + " at sequence number " +
                        event.sequenceNumber() + " of stream " + streamId, e);
            }
            version = event.sequenceNumber();
        }
        logger.trace("Loaded stream {} at version {} ({} events replayed, snapshot {})",
                streamId, version, events.size(), seed.fromSnapshot() ? seed.sequenceNumber() : "none");
        return new StateRef<>(streamId, state, version);
    }

    private Optional<Seed<S>> seedFromSnapshot(String streamId) {
        try {
            Optional<SnapshotRecord> snapshot = snapshotStore.latest(streamId);
            if (snapshot.isEmpty()) {
                return Optional.empty();
            }
            SnapshotRecord snapshotRecord = snapshot.get();
            if (snapshotRecord.sequenceNumber() <= 0L) {
                return Optional.empty();
            }
            try {
                S state = runtime.materializeState(snapshotRecord);
                return Optional.of(new Seed<>(state, snapshotRecord.sequenceNumber(), true));
            } catch (IOException | RuntimeException e) {
                throw new SnapshotCorruptException(streamId, snapshotRecord.sequenceNumber(),
                        "Cannot materialize snapshot of stream " + streamId, e);
            }
        } catch (SnapshotCorruptException e) {
            logger.warn("Snapshot of stream {} at sequence number {} is corrupt, falling back to full replay",
                    streamId, e.getSequenceNumber(), e);
            return Optional.empty();
        } catch (StorageUnavailableException e) {
            logger.warn("Snapshot store unavailable for stream {}, falling back to full replay", streamId, e);
            return Optional.empty();
        }
    }

    private boolean isConsistent(String streamId, Seed<S> seed, List<DomainEventRecord> events) {
        if (!events.isEmpty()) {
            long first = events.get(0).sequenceNumber();
            if (first != seed.sequenceNumber() + 1) {
                logger.warn("Snapshot of stream {} at sequence number {} does not line up with the event log (next event is {}), " +
                        "falling back to full replay", streamId, seed.sequenceNumber(), first);
                return false;
            }
            return true;
        }
        // nothing after the snapshot, make sure the snapshot is not ahead of the log
        long currentVersion = eventStore.currentVersion(streamId);
        if (currentVersion < seed.sequenceNumber()) {
            logger.warn("Snapshot of stream {} at sequence number {} is ahead of the event log at {}, " +
                    "falling back to full replay", streamId, seed.sequenceNumber(), currentVersion);
            return false;
        }
        return true;
    }

    private Seed<S> emptySeed() {
        return new Seed<>(runtime.initialState(), StateRef.NO_EVENTS, false);
    }

    private record Seed<T>(T state, long sequenceNumber, boolean fromSnapshot) {
    }
}
