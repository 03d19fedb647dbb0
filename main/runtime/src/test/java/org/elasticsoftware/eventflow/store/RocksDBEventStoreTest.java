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
import org.elasticsoftware.eventflow.serialization.RecordSerde;
import org.elasticsoftware.eventflowtest.counter.CounterFixtures;
import org.elasticsoftware.eventflowtest.counter.IncrementedEvent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.elasticsoftware.eventflowtest.counter.CounterFixtures.uncommitted;
import static org.junit.jupiter.api.Assertions.*;

class RocksDBEventStoreTest extends EventStoreContract {
    private final RecordSerde<DomainEventRecord> serde = new RecordSerde<>(CounterFixtures.OBJECT_MAPPER, DomainEventRecord.class);

    @TempDir
    Path tempDir;

    @Override
    protected EventStore createStore() {
        return new RocksDBEventStore(tempDir.toString(), "events", serde.serializer(), serde.deserializer());
    }

    @Test
    void testEventsSurviveReopen() {
        store.append("counter-1", 0L, uncommitted(runtime, new IncrementedEvent(5), new IncrementedEvent(3)));
        store.close();

        store = createStore();

        List<DomainEventRecord> events = store.getEvents("counter-1", 0L);
        assertEquals(2, events.size());
        assertEquals(2L, store.currentVersion("counter-1"));
        assertInstanceOf(CommitResult.Conflict.class,
                store.append("counter-1", 0L, uncommitted(runtime, new IncrementedEvent(1))));
    }

    @Test
    void testStreamIdPrefixDoesNotLeakIntoOtherStreams() {
        store.append("counter", 0L, uncommitted(runtime, new IncrementedEvent(1)));
        store.append("counter-2", 0L, uncommitted(runtime, new IncrementedEvent(2), new IncrementedEvent(2)));

        assertEquals(1, store.getEvents("counter", 0L).size());
        assertEquals(2, store.getEvents("counter-2", 0L).size());
    }

    @Test
    void testStreamIdWithNulIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> store.getEvents("bad\u0000id", 0L));
    }
}
