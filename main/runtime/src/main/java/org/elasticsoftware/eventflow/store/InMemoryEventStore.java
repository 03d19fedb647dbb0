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

package org.elasticsoftware.eventflow.store;

import org.elasticsoftware.eventflow.protocol.DomainEventRecord;
import org.elasticsoftware.eventflow.protocol.UncommittedEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps every stream in an append-only list. Reads return copies, so a returned list never changes
 * after later appends.
 */
public class InMemoryEventStore implements EventStore {
    private final Map<String, Stream> streams = new ConcurrentHashMap<>();

    @Override
    public List<DomainEventRecord> getEvents(String streamId, long afterSequenceNumber) {
        Stream stream = streams.get(streamId);
        return stream != null ? stream.eventsAfter(afterSequenceNumber) : List.of();
    }

    @Override
    public CommitResult append(String streamId, long expectedVersion, List<UncommittedEvent> events) {
        return streams.computeIfAbsent(streamId, Stream::new).append(expectedVersion, true, events);
    }

    @Override
    public CommitResult appendUnconditionally(String streamId, List<UncommittedEvent> events) {
        return streams.computeIfAbsent(streamId, Stream::new).append(-1L, false, events);
    }

    @Override
    public long currentVersion(String streamId) {
        Stream stream = streams.get(streamId);
        return stream != null ? stream.version() : 0L;
    }

    private static final class Stream {
        private final String streamId;
        // sequence number n lives at index n-1
        private final List<DomainEventRecord> events = new ArrayList<>();

        Stream(String streamId) {
            this.streamId = streamId;
        }

        synchronized List<DomainEventRecord> eventsAfter(long afterSequenceNumber) {
            int fromIndex = (int) Math.min(Math.max(afterSequenceNumber, 0L), events.size());
            return List.copyOf(events.subList(fromIndex, events.size()));
        }

        synchronized long version() {
            return events.size();
        }

        synchronized CommitResult append(long expectedVersion, boolean conditional, List<UncommittedEvent> uncommitted) {
            long actualVersion = events.size();
            if (conditional && actualVersion != expectedVersion) {
                return new CommitResult.Conflict(expectedVersion, actualVersion);
            }
            List<DomainEventRecord> appended = new ArrayList<>(uncommitted.size());
            long sequenceNumber = actualVersion;
            for (UncommittedEvent event : uncommitted) {
                appended.add(event.toRecord(streamId, ++sequenceNumber));
            }
            events.addAll(appended);
            return new CommitResult.Committed(sequenceNumber, List.copyOf(appended));
        }
    }
}
