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

import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.serialization.Deserializer;
import org.apache.kafka.common.serialization.Serializer;
import org.elasticsoftware.eventflow.errors.EventStoreException;
import org.elasticsoftware.eventflow.errors.SnapshotCorruptException;
import org.elasticsoftware.eventflow.errors.StorageUnavailableException;
import org.elasticsoftware.eventflow.protocol.SnapshotRecord;
import org.rocksdb.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Optional;

public class RocksDBSnapshotStore implements SnapshotStore {
    private static final Logger log = LoggerFactory.getLogger(RocksDBSnapshotStore.class);
    private static final String TOPIC = "EventFlow-Snapshots";
    private final TransactionDB db;
    private final File baseDir;
    private final Serializer<SnapshotRecord> serializer;
    private final Deserializer<SnapshotRecord> deserializer;

    public RocksDBSnapshotStore(String baseDir,
                                String name,
                                Serializer<SnapshotRecord> serializer,
                                Deserializer<SnapshotRecord> deserializer) {
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
            log.info("RocksDB snapshot store {} initialized in folder {}", name, this.baseDir.getAbsolutePath());
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
    public Optional<SnapshotRecord> latest(String streamId) {
        try {
            byte[] value = db.get(keyBytes(streamId));
            return value != null ? Optional.of(deserializer.deserialize(TOPIC, value)) : Optional.empty();
        } catch (RocksDBException e) {
            throw new StorageUnavailableException(streamId, "Error reading snapshot of stream " + streamId, e);
        } catch (SerializationException e) {
            throw new SnapshotCorruptException(streamId, -1L, "Unreadable snapshot record for stream " + streamId, e);
        }
    }

    @Override
    public void put(SnapshotRecord snapshotRecord) {
        byte[] key = keyBytes(snapshotRecord.streamId());
        try (WriteOptions writeOptions = new WriteOptions();
             ReadOptions readOptions = new ReadOptions();
             Transaction transaction = db.beginTransaction(writeOptions)) {
            byte[] current = transaction.getForUpdate(readOptions, key, true);
            if (current != null && isAtLeast(current, snapshotRecord.sequenceNumber())) {
                transaction.rollback();
                return;
            }
            transaction.put(key, serializer.serialize(TOPIC, snapshotRecord));
            transaction.commit();
        } catch (RocksDBException e) {
            throw new StorageUnavailableException(snapshotRecord.streamId(), "Error writing snapshot of stream " + snapshotRecord.streamId(), e);
        }
    }

    private boolean isAtLeast(byte[] currentValue, long sequenceNumber) {
        try {
            return deserializer.deserialize(TOPIC, currentValue).sequenceNumber() >= sequenceNumber;
        } catch (SerializationException e) {
            // an unreadable snapshot is always replaced
            log.warn("Replacing unreadable snapshot", e);
            return false;
        }
    }

    private static byte[] keyBytes(String streamId) {
        return streamId.getBytes(StandardCharsets.UTF_8);
    }
}
