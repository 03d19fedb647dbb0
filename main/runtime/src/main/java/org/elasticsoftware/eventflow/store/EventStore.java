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

import org.elasticsoftware.eventflow.errors.StorageUnavailableException;
import org.elasticsoftware.eventflow.protocol.DomainEventRecord;
import org.elasticsoftware.eventflow.protocol.UncommittedEvent;

import java.io.Closeable;
import java.util.List;

/**
 * Per-stream ordered, append-only event log with a conditional multi-event append.
 */
public interface EventStore extends Closeable {

    /**
     * Events with a sequence number strictly greater than {@code afterSequenceNumber}, ascending.
     *
     * @throws StorageUnavailableException when the store cannot be read
     */
    List<DomainEventRecord> getEvents(String streamId, long afterSequenceNumber);

    /**
     * Appends the events with consecutive sequence numbers starting at {@code expectedVersion + 1} if,
     * and only if, the last sequence number of the stream equals {@code expectedVersion}.
     */
    CommitResult append(String streamId, long expectedVersion, List<UncommittedEvent> events);

    /**
     * Appends the events after whatever the stream currently holds. Never returns a conflict.
     */
    CommitResult appendUnconditionally(String streamId, List<UncommittedEvent> events);

    /**
     * @throws StorageUnavailableException when the store cannot be read
     */
    long currentVersion(String streamId);

    @Override
    default void close() {
    }
}
