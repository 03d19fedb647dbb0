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

import com.google.common.primitives.Bytes;
import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.serialization.Deserializer;
import org.apache.kafka.common.serialization.Serializer;
import org.elasticsoftware.eventflow.errors.EventStoreException;
import org.elasticsoftware.eventflow.errors.StorageUnavailableException;
import org.elasticsoftware.eventflow.protocol.DomainEventRecord;
import org.elasticsoftware.eventflow.protocol.UncommittedEvent;
import org.rocksdb.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Event store on a RocksDB {@link TransactionDB}. Every stream has a head key holding its last
 * sequence number, an append locks the head with {@code getForUpdate} so the version check and the
 * writes of all events commit as one transaction.
 * <p>
 * Keys start with a one byte kind and the length prefixed UTF-8 stream id, event keys end with the
 * big endian sequence number. Any stream id is accepted.
 */
public class RocksDBEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(RocksDBEventStore.class);
    private static final byte EVENT_PREFIX = 0x45;
    private static final byte HEAD_PREFIX = 0x56;
    private static final String TOPIC = "EventFlow-Events";
    private final TransactionDB db;
    private final File baseDir;
    private final Serializer<DomainEventRecord> serializer;
    private final Deserializer<DomainEventRecord> deserializer;

    public RocksDBEventStore(String baseDir,
                             String name,
                             Serializer<DomainEventRecord> serializer,
                             Deserializer<DomainEventRecord> deserializer) {
        this.serializer = serializer;
        this.deserializer = deserializer;
        RocksDB.loadLibrary();
        final Options options = new Options();
        final TransactionDBOptions transactionDBOptions = new TransactionDBOptions();
        options.setCreateIfMissing(true);
        this.baseDir = new File(baseDir, name);
        try {
            Files.createDirectories(this.baseDir.getAbsoluteFile().toPath());
            db = TransactionDB.open(options, transactionDBOptions, this.baseDir.getAbsolutePath());
            log.info("RocksDB event store {} initialized in folder {}", name, this.baseDir.getAbsolutePath());
        } catch (IOException | RocksDBException e) {
            throw new EventStoreException("Error initializing RocksDB", e);
        }
    }

    @Override
    public void close() {
        try {
            db.syncWal();
        } catch (RocksDBException e) {
            log.error("Error syncing WAL. Exception: '{}', message: '{}'", e.getCause(), e.getMessage(), e);
        }
        db.close();
    }

    @Override
    public List<DomainEventRecord> getEvents(String streamId, long afterSequenceNumber) {
        byte[] prefix = eventPrefix(streamId);
        List<DomainEventRecord> events = new ArrayList<>();
        try (RocksIterator iterator = db.newIterator()) {
            iterator.seek(eventKey(streamId, Math.max(afterSequenceNumber, 0L) + 1));
            while (iterator.isValid() && startsWith(iterator.key(), prefix)) {
                events.add(deserializer.deserialize(TOPIC, iterator.value()));
                iterator.next();
            }
            iterator.status();
        } catch (RocksDBException | SerializationException e) {
            throw new StorageUnavailableException(streamId, "Error reading events of stream " + streamId, e);
        }
        return events;
    }

    @Override
    public CommitResult append(String streamId, long expectedVersion, List<UncommittedEvent> events) {
        return doAppend(streamId, expectedVersion, true, events);
    }

    @Override
    public CommitResult appendUnconditionally(String streamId, List<UncommittedEvent> events) {
        return doAppend(streamId, -1L, false, events);
    }

    @Override
    public long currentVersion(String streamId) {
        try {
            byte[] head = db.get(headKey(streamId));
            return head != null ? Longs.fromByteArray(head) : 0L;
        } catch (RocksDBException e) {
            throw new StorageUnavailableException(streamId, "Error reading version of stream " + streamId, e);
        }
    }

    private CommitResult doAppend(String streamId, long expectedVersion, boolean conditional, List<UncommittedEvent> events) {
        byte[] headKey = headKey(streamId);
        try (WriteOptions writeOptions = new WriteOptions();
             ReadOptions readOptions = new ReadOptions();
             Transaction transaction = db.beginTransaction(writeOptions)) {
            byte[] head = transaction.getForUpdate(readOptions, headKey, true);
            long actualVersion = head != null ? Longs.fromByteArray(head) : 0L;
            if (conditional && actualVersion != expectedVersion) {
                transaction.rollback();
                log.trace("Version conflict on stream {}: expected {} but was {}", streamId, expectedVersion, actualVersion);
                return new CommitResult.Conflict(expectedVersion, actualVersion);
            }
            List<DomainEventRecord> records = new ArrayList<>(events.size());
            long sequenceNumber = actualVersion;
            for (UncommittedEvent event : events) {
                DomainEventRecord eventRecord = event.toRecord(streamId, ++sequenceNumber);
                transaction.put(eventKey(streamId, sequenceNumber), serializer.serialize(TOPIC, eventRecord));
                records.add(eventRecord);
            }
            if (!records.isEmpty()) {
                transaction.put(headKey, Longs.toByteArray(sequenceNumber));
            }
            transaction.commit();
            return new CommitResult.Committed(sequenceNumber, List.copyOf(records));
        } catch (RocksDBException | SerializationException e) {
            return new CommitResult.Unavailable(
                    new StorageUnavailableException(streamId, "Error appending to stream " + streamId, e));
        }
    }

    private static byte[] streamIdKey(byte kind, String streamId) {
        byte[] bytes = streamId.getBytes(StandardCharsets.UTF_8);
        return Bytes.concat(new byte[]{kind}, Ints.toByteArray(bytes.length), bytes);
    }

    private static byte[] eventPrefix(String streamId) {
        return streamIdKey(EVENT_PREFIX, streamId);
    }

    private static byte[] eventKey(String streamId, long sequenceNumber) {
        // big endian keeps the iteration order equal to the sequence order
        return Bytes.concat(eventPrefix(streamId), Longs.toByteArray(sequenceNumber));
    }

    private static byte[] headKey(String streamId) {
        return streamIdKey(HEAD_PREFIX, streamId);
    }

    private static boolean startsWith(byte[] key, byte[] prefix) {
        return key.length >= prefix.length && Arrays.equals(key, 0, prefix.length, prefix, 0, prefix.length);
    }
}
