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

import java.util.List;

public sealed interface CommitResult permits CommitResult.Committed, CommitResult.Conflict, CommitResult.Unavailable {

    /**
     * All events were appended, {@code newVersion} is the sequence number of the last one.
     */
    record Committed(long newVersion, List<DomainEventRecord> records) implements CommitResult {
    }

    /**
     * The stream moved past the expected version, nothing was appended.
     */
    record Conflict(long expectedVersion, long actualVersion) implements CommitResult {
    }

    /**
     * The store could not be reached, the append either fully happened or not at all.
     */
    record Unavailable(StorageUnavailableException cause) implements CommitResult {
    }
}
