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

/**
 * Decides whether a commit that moved a stream from {@code previousVersion} to {@code newVersion}
 * should be followed by a snapshot.
 */
@FunctionalInterface
public interface SnapshotPolicy {
    boolean shouldSnapshot(long previousVersion, long newVersion);

    static SnapshotPolicy never() {
        return (previousVersion, newVersion) -> false;
    }

    /**
     * Snapshot whenever the stream crosses a multiple of {@code frequency} events.
     */
    static SnapshotPolicy everyEvents(int frequency) {
        if (frequency <= 0) {
            throw new IllegalArgumentException("Snapshot frequency must be positive, got " + frequency);
        }
        return (previousVersion, newVersion) -> newVersion / frequency > previousVersion / frequency;
    }
}
