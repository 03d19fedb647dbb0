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

package org.elasticsoftware.eventflow.kafka;

import org.apache.kafka.clients.consumer.ConsumerGroupMetadata;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.AuthorizationException;
import org.apache.kafka.common.errors.OutOfOrderSequenceException;
import org.apache.kafka.common.errors.ProducerFencedException;
import org.apache.kafka.common.errors.UnsupportedVersionException;
import org.elasticsoftware.eventflow.errors.TransactionAbortedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Future;

/**
 * Binds the records produced while handling consumed messages and the offsets of those messages into
 * one producer transaction. Either both become visible to read_committed consumers or neither does.
 * <p>
 * One transaction at a time: the producer is owned by a single partition thread.
 */
public class ExactlyOnceCoordinator<K, V> {
    private static final Logger logger = LoggerFactory.getLogger(ExactlyOnceCoordinator.class);
    private final Producer<K, V> producer;
    private final String transactionalId;
    private Transaction<K, V> currentTransaction;

    public ExactlyOnceCoordinator(Producer<K, V> producer, String transactionalId) {
        this.producer = producer;
        this.transactionalId = transactionalId;
    }

    /**
     * Runs the work in a transaction and commits the consumed offsets with it.
     *
     * @param groupMetadata metadata of the consumer the offsets belong to, {@code null} to commit only the
     *                      produced records
     * @return the consumed offsets that were committed, already incremented to the next offset to read
     * @throws TransactionAbortedException when the transaction was aborted, nothing was committed
     * @throws ProducerFencedException     when another producer with the same transactional id took over
     */
    public Map<TopicPartition, OffsetAndMetadata> execute(ConsumerGroupMetadata groupMetadata, TransactionalWork<K, V> work) {
        if (currentTransaction != null) {
            throw new IllegalStateException("Transaction already in progress for " + transactionalId);
        }
        Transaction<K, V> transaction = new Transaction<>(producer);
        currentTransaction = transaction;
        boolean began = false;
        try {
            producer.beginTransaction();
            began = true;
            work.execute(transaction);
            Map<TopicPartition, OffsetAndMetadata> offsets = transaction.offsetsToCommit();
            if (groupMetadata != null && !offsets.isEmpty()) {
                producer.sendOffsetsToTransaction(offsets, groupMetadata);
            }
            producer.commitTransaction();
            logger.trace("Committed transaction {} with {} records and offsets {}",
                    transactionalId, transaction.sent.size(), offsets);
            return offsets;
        } catch (ProducerFencedException | OutOfOrderSequenceException | AuthorizationException |
                 UnsupportedVersionException e) {
            // fatal for a transactional producer, it must be closed
            throw e;
        } catch (Exception e) {
            if (began) {
                abort(e);
            }
            throw new TransactionAbortedException(transaction.streamId,
                    "Transaction " + transactionalId + " aborted", e);
        } finally {
            transaction.completed = true;
            currentTransaction = null;
        }
    }

    public boolean isInTransaction() {
        return currentTransaction != null;
    }

    public String getTransactionalId() {
        return transactionalId;
    }

    private void abort(Exception cause) {
        logger.warn("Aborting transaction {}", transactionalId, cause);
        try {
            producer.abortTransaction();
        } catch (KafkaException abortFailure) {
            abortFailure.addSuppressed(cause);
            throw abortFailure;
        }
    }

    /**
     * Handle on the running transaction, only valid inside {@link TransactionalWork#execute}.
     */
    public static final class Transaction<K, V> {
        private final Producer<K, V> producer;
        private final Map<TopicPartition, Long> consumed = new HashMap<>();
        private final List<Future<RecordMetadata>> sent = new ArrayList<>();
        private String streamId;
        private boolean completed = false;

        private Transaction(Producer<K, V> producer) {
            this.producer = producer;
        }

        public Future<RecordMetadata> send(ProducerRecord<K, V> producerRecord) {
            checkActive();
            Future<RecordMetadata> future = KafkaSender.send(producer, producerRecord);
            sent.add(future);
            return future;
        }

        /**
         * Marks the record at {@code offset} as consumed, its successor is committed with the transaction.
         */
        public void markConsumed(TopicPartition topicPartition, long offset) {
            checkActive();
            consumed.merge(topicPartition, offset, Math::max);
        }

        /**
         * Stream currently being handled, reported when the transaction aborts.
         */
        public void setStreamId(String streamId) {
            this.streamId = streamId;
        }

        public Map<TopicPartition, Long> getConsumed() {
            return Collections.unmodifiableMap(consumed);
        }

        private Map<TopicPartition, OffsetAndMetadata> offsetsToCommit() {
            Map<TopicPartition, OffsetAndMetadata> offsets = new HashMap<>();
            consumed.forEach((topicPartition, offset) -> offsets.put(topicPartition, new OffsetAndMetadata(offset + 1)));
            return offsets;
        }

        private void checkActive() {
            if (completed) {
                throw new IllegalStateException("Transaction already completed");
            }
        }
    }
}
