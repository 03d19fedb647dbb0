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

import java.time.Duration;

/**
 * Bounds for the dispatch loop. Conflicts reload immediately, storage failures back off
 * exponentially from {@code initialBackoff} up to {@code maxBackoff}.
 */
public record RetryPolicy(int maxConflictRetries,
                          int maxStorageRetries,
                          Duration initialBackoff,
                          Duration maxBackoff,
                          double multiplier) {
    public static final RetryPolicy DEFAULT = new RetryPolicy(10, 3, Duration.ofMillis(50), Duration.ofSeconds(2), 2.0);

    public RetryPolicy {
        if (maxConflictRetries < 0 || maxStorageRetries < 0) {
            throw new IllegalArgumentException("Retry counts must not be negative");
        }
        if (initialBackoff.isNegative() || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("Invalid backoff range " + initialBackoff + " - " + maxBackoff);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("Backoff multiplier must be at least 1.0, got " + multiplier);
        }
    }

    public RetryPolicy withMaxConflictRetries(int maxConflictRetries) {
        return new RetryPolicy(maxConflictRetries, maxStorageRetries, initialBackoff, maxBackoff, multiplier);
    }

    public RetryPolicy withMaxStorageRetries(int maxStorageRetries) {
        return new RetryPolicy(maxConflictRetries, maxStorageRetries, initialBackoff, maxBackoff, multiplier);
    }

    /**
     * Delay before the given storage retry, the first retry is 1.
     */
    public Duration backoff(int retry) {
        double factor = Math.pow(multiplier, Math.min(Math.max(retry - 1, 0), 30));
        double millis = Math.min(initialBackoff.toMillis() * factor, maxBackoff.toMillis());
        return Duration.ofMillis((long) millis);
    }
}
