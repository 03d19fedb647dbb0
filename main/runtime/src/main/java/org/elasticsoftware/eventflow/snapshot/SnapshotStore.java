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

package org.elasticsoftware.eventflow.snapshot;

import org.elasticsoftware.eventflow.errors.StorageUnavailableException;
import org.elasticsoftware.eventflow.protocol.SnapshotRecord;

import java.io.Closeable;
import java.util.Optional;

/**
 * Cache of materialized stream state. A snapshot is never authoritative: callers fall back to a full
 * replay when it is absent or unreadable. Implementations may lag behind the event log but must never
 * return a snapshot ahead of it.
 */
public interface SnapshotStore extends Closeable {

    /**
     * @throws StorageUnavailableException when the store cannot be read
     */
    Optional<SnapshotRecord> latest(String streamId);

    /**
     * Stores the snapshot unless a snapshot with the same or a higher sequence number is already present.
     *
     * @throws StorageUnavailableException when the store cannot be written
     */
    void put(SnapshotRecord snapshotRecord);

    @Override
    default void close() {
    }

    static SnapshotStore none() {
        return NoSnapshotStore.INSTANCE;
    }
}
