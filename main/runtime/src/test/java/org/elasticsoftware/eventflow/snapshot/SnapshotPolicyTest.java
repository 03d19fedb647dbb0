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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotPolicyTest {

    @Test
    void testNever() {
        assertFalse(SnapshotPolicy.never().shouldSnapshot(0L, 1000L));
    }

    @Test
    void testEveryEventsTriggersWhenCrossingAMultiple() {
        SnapshotPolicy policy = SnapshotPolicy.everyEvents(10);

        assertFalse(policy.shouldSnapshot(0L, 9L));
        assertTrue(policy.shouldSnapshot(9L, 10L));
        assertTrue(policy.shouldSnapshot(8L, 12L));
        assertFalse(policy.shouldSnapshot(10L, 19L));
        assertTrue(policy.shouldSnapshot(5L, 31L));
    }

    @Test
    void testFrequencyMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> SnapshotPolicy.everyEvents(0));
    }
}
