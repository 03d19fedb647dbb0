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

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerGroupMetadata;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.AuthorizationException;
import org.apache.kafka.common.errors.InterruptException;
import org.apache.kafka.common.errors.OutOfOrderSequenceException;
import org.apache.kafka.common.errors.ProducerFencedException;
import org.apache.kafka.common.errors.WakeupException;
import org.elasticsoftware.eventflow.EventFlowException;
import org.elasticsoftware.eventflow.dispatch.DispatchLoop;
import org.elasticsoftware.eventflow.dispatch.DispatchResult;
import org.elasticsoftware.eventflow.errors.TransactionAbortedException;
import org.elasticsoftware.eventflow.handlers.PublishedMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.ConsumerFactory;

import java.time.Clock;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.function.Function;

import static java.util.Collections.singletonList;
import static org.elasticsoftware.eventflow.kafka.PartitionProcessorState.INITIALIZING;
import static org.elasticsoftware.eventflow.kafka.PartitionProcessorState.PROCESSING;
import static org.elasticsoftware.eventflow.kafka.PartitionProcessorState.SHUTTING_DOWN;

/**
 * Consumes one input topic-partition on its own thread, dispatches every record and publishes what the
 * handlers produced. With {@link KafkaMessagePublishingStrategy#EXACTLY_ONCE_SEMANTICS} the published
 * records and the consumed offsets of a batch commit in one producer transaction, on abort the consumer
 * is rewound so the batch is delivered again.
 */
public class KafkaPartitionProcessor<M, S> implements Runnable, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(KafkaPartitionProcessor.class);
    static final int MAX_CONSECUTIVE_ABORTS = 5;
    private final ConsumerFactory<String, M> consumerFactory;
    private final CustomKafkaProducerFactory<String, Object> producerFactory;
    private final DispatchLoop<M, S> dispatchLoop;
    private final KafkaSubscriptionConfiguration<M> subscription;
    private final KafkaPublisherConfiguration publisher;
    private final TopicPartition inputPartition;
    private final KafkaTopic topic;
    private final StreamIdResolver<M> streamIdResolver;
    private final ProcessingFailureHandler<M> failureHandler;
    private final Clock clock;
    private final Map<TopicPartition, OffsetAndMetadata> pendingOffsets = new HashMap<>();
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);
    private Consumer<String, M> consumer;
    private Producer<String, Object> producer;
    private ExactlyOnceCoordinator<String, Object> coordinator;
    private volatile PartitionProcessorState processState = INITIALIZING;
    private volatile boolean started = false;
    private long lastOffsetCommit;
    private int consecutiveAborts = 0;

    public KafkaPartitionProcessor(ConsumerFactory<String, M> consumerFactory,
                                   CustomKafkaProducerFactory<String, Object> producerFactory,
                                   DispatchLoop<M, S> dispatchLoop,
                                   KafkaSubscriptionConfiguration<M> subscription,
                                   KafkaPublisherConfiguration publisher,
                                   TopicPartition inputPartition,
                                   StreamIdResolver<M> streamIdResolver,
                                   ProcessingFailureHandler<M> failureHandler,
                                   Clock clock) {
        if (publisher.getMessagePublishingStrategy() == KafkaMessagePublishingStrategy.EXACTLY_ONCE_SEMANTICS
                && !subscription.isEos()) {
            throw new IllegalArgumentException("The EXACTLY_ONCE_SEMANTICS publishing strategy requires a " +
                    "subscription with eos enabled for consumer group " + subscription.getGroup());
        }
        this.consumerFactory = consumerFactory;
        this.producerFactory = producerFactory;
        this.dispatchLoop = dispatchLoop;
        this.subscription = subscription;
        this.publisher = publisher;
        this.inputPartition = inputPartition;
        this.topic = subscription.getTopic(inputPartition.topic()).orElseThrow(() ->
                new IllegalArgumentException("Topic " + inputPartition.topic() + " is not part of the subscription"));
        this.streamIdResolver = streamIdResolver;
        this.failureHandler = failureHandler;
        this.clock = clock;
    }

    public TopicPartition getInputPartition() {
        return inputPartition;
    }

    public PartitionProcessorState getProcessState() {
        return processState;
    }

    @Override
    public void run() {
        started = true;
        try {
            logger.info("Starting KafkaPartitionProcessor for {} of {}", inputPartition, dispatchLoop.getAggregatorName());
            open();
            while (processState != SHUTTING_DOWN) {
                process();
            }
        } catch (Throwable t) {
            logger.error("Unexpected error in KafkaPartitionProcessor for {}", inputPartition, t);
        } finally {
            shutdown();
            logger.info("Finished shutting down KafkaPartitionProcessor for {}", inputPartition);
            shutdownLatch.countDown();
        }
    }

    @Override
    public void close() throws InterruptedException {
        processState = SHUTTING_DOWN;
        if (started) {
            shutdownLatch.await();
        }
    }

    void open() {
        String clientId = subscription.getGroup() + "-" + inputPartition.topic() + "-" + inputPartition.partition();
        Properties overrides = new Properties();
        subscription.getMaxBytesPerPartition().ifPresent(maxBytes ->
                overrides.put(ConsumerConfig.MAX_PARTITION_FETCH_BYTES_CONFIG, maxBytes.toString()));
        this.consumer = consumerFactory.createConsumer(subscription.getGroup(), clientId, null, overrides);
        this.producer = producerFactory.createPartitionProducer(publisher, inputPartition);
        if (publisher.isTransactional()) {
            this.coordinator = new ExactlyOnceCoordinator<>(producer,
                    publisher.transactionalIdFor(inputPartition.topic(), inputPartition.partition()));
        }
        // hard assignment, the partition is never rebalanced away
        consumer.assign(singletonList(inputPartition));
        this.lastOffsetCommit = clock.millis();
    }

    void process() {
        try {
            if (processState == PROCESSING) {
                pollOnce();
            } else if (processState == INITIALIZING) {
                initialize();
            }
        } catch (WakeupException | InterruptException ignore) {
            // non-fatal, the loop checks the state again
        } catch (ProducerFencedException | OutOfOrderSequenceException | AuthorizationException e) {
            logger.error("Fatal error during " + processState + " phase, shutting down KafkaPartitionProcessor for " + inputPartition, e);
            processState = SHUTTING_DOWN;
        } catch (KafkaException e) {
            logger.error("Fatal error during " + processState + " phase, shutting down KafkaPartitionProcessor for " + inputPartition, e);
            processState = SHUTTING_DOWN;
        } catch (RuntimeException e) {
            logger.error("Unrecoverable error during " + processState + " phase, shutting down KafkaPartitionProcessor for " + inputPartition, e);
            processState = SHUTTING_DOWN;
        }
    }

    private void initialize() {
        logger.info("Initializing KafkaPartitionProcessor for {} with offset reset strategy {}",
                inputPartition, topic.offsetResetStrategy());
        switch (topic.offsetResetStrategy()) {
            case ALWAYS_EARLIEST -> consumer.seekToBeginning(singletonList(inputPartition));
            case ALWAYS_LATEST -> consumer.seekToEnd(singletonList(inputPartition));
            case EARLIEST, LATEST -> {
                OffsetAndMetadata committed = consumer.committed(Set.of(inputPartition)).get(inputPartition);
                if (committed != null) {
                    logger.info("Resuming {} from committed offset {}", inputPartition, committed.offset());
                    consumer.seek(inputPartition, committed.offset());
                } else if (topic.offsetResetStrategy() == KafkaOffsetResetStrategy.EARLIEST) {
                    consumer.seekToBeginning(singletonList(inputPartition));
                } else {
                    consumer.seekToEnd(singletonList(inputPartition));
                }
            }
        }
        processState = PROCESSING;
    }

    private void pollOnce() {
        ConsumerRecords<String, M> records = consumer.poll(subscription.getConsumeTimeout());
        List<ConsumerRecord<String, M>> partitionRecords = records.records(inputPartition);
        int batchSize = publisher.getMaximumBatchSize();
        for (int from = 0; from < partitionRecords.size() && processState == PROCESSING; from += batchSize) {
            List<ConsumerRecord<String, M>> batch = partitionRecords.subList(from, Math.min(from + batchSize, partitionRecords.size()));
            if (!processBatch(batch)) {
                // the rest of the poll is delivered again after the rewind
                break;
            }
        }
        if (!publisher.isTransactional()) {
            commitPendingOffsets(false);
        }
    }

    /**
     * @return {@code false} when the consumer was rewound and the remaining records must not be processed
     */
    private boolean processBatch(List<ConsumerRecord<String, M>> batch) {
        if (logger.isTraceEnabled()) {
            logger.trace("Processing {} records from {} using {}", batch.size(), inputPartition,
                    publisher.getMessagePublishingStrategy());
        }
        return switch (publisher.getMessagePublishingStrategy()) {
            case EXACTLY_ONCE_SEMANTICS -> processInTransaction(batch, consumer.groupMetadata());
            case TRANSACTIONAL -> processInTransaction(batch, null);
            case NON_TRANSACTIONAL -> {
                processWithoutTransaction(batch);
                yield true;
            }
        };
    }

    private boolean processInTransaction(List<ConsumerRecord<String, M>> batch, ConsumerGroupMetadata groupMetadata) {
        try {
            Map<TopicPartition, OffsetAndMetadata> offsets = coordinator.execute(groupMetadata, transaction -> {
                for (ConsumerRecord<String, M> consumerRecord : batch) {
                    if (!handleRecord(consumerRecord, transaction::send, transaction::setStreamId)) {
                        // everything before the failed record still commits
                        processState = SHUTTING_DOWN;
                        return;
                    }
                    transaction.markConsumed(inputPartition, consumerRecord.offset());
                }
            });
            if (groupMetadata == null && !offsets.isEmpty()) {
                consumer.commitSync(offsets);
            }
            consecutiveAborts = 0;
            return true;
        } catch (TransactionAbortedException e) {
            consecutiveAborts++;
            rollbackConsumer(batch);
            if (consecutiveAborts >= MAX_CONSECUTIVE_ABORTS) {
                logger.error("{} consecutive aborted transactions, shutting down KafkaPartitionProcessor for {}",
                        consecutiveAborts, inputPartition, e);
                processState = SHUTTING_DOWN;
            } else {
                logger.warn("Transaction aborted for {} while handling stream {}, redelivering from offset {}",
                        inputPartition, e.getStreamId(), batch.get(0).offset(), e);
            }
            return false;
        }
    }

    private void processWithoutTransaction(List<ConsumerRecord<String, M>> batch) {
        for (ConsumerRecord<String, M> consumerRecord : batch) {
            if (!handleRecord(consumerRecord, producerRecord -> KafkaSender.send(producer, producerRecord), streamId -> { })) {
                processState = SHUTTING_DOWN;
                return;
            }
            pendingOffsets.put(inputPartition, new OffsetAndMetadata(consumerRecord.offset() + 1));
        }
    }

    /**
     * @return {@code false} when the record failed and the partition has to stop
     */
    private boolean handleRecord(ConsumerRecord<String, M> consumerRecord,
                                 Function<ProducerRecord<String, Object>, Future<RecordMetadata>> sender,
                                 java.util.function.Consumer<String> streamIdListener) {
        ConsumerRecord<String, M> preprocessed = subscription.getPreprocessor().process(consumerRecord);
        if (preprocessed == null || preprocessed.value() == null) {
            logger.trace("Skipping tombstone at offset {} of {}", consumerRecord.offset(), inputPartition);
            return true;
        }
        String streamId = streamIdResolver.resolve(preprocessed);
        if (streamId == null) {
            logger.warn("No stream id for record at offset {} of {}, skipping", preprocessed.offset(), inputPartition);
            return true;
        }
        streamIdListener.accept(streamId);
        try {
            DispatchResult<S> result = dispatchLoop.dispatch(streamId, preprocessed.value(), metadata(preprocessed));
            long timestamp = clock.millis();
            for (PublishedMessage message : result.publishedMessages()) {
                sender.apply(KafkaSender.toProducerRecord(message, publisher.getDefaultTopic().orElse(null),
                        publisher.getHeaderNames(), streamId, result.version(), timestamp));
            }
            return true;
        } catch (TransactionAbortedException e) {
            throw e;
        } catch (EventFlowException e) {
            ProcessingFailureHandler.Action action = failureHandler.onFailure(preprocessed, e);
            if (action == ProcessingFailureHandler.Action.SHUTDOWN) {
                logger.error("Failed to process record at offset {} of {} for stream {}, shutting down",
                        preprocessed.offset(), inputPartition, streamId, e);
                return false;
            }
            return true;
        }
    }

    private Map<String, Object> metadata(ConsumerRecord<String, M> consumerRecord) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put(KafkaMetadata.TIMESTAMP.key(), consumerRecord.timestamp());
        metadata.put(KafkaMetadata.TOPIC.key(), consumerRecord.topic());
        metadata.put(KafkaMetadata.OFFSET.key(), consumerRecord.offset());
        metadata.put(KafkaMetadata.PARTITION.key(), consumerRecord.partition());
        metadata.put(KafkaMetadata.KEY.key(), consumerRecord.key());
        metadata.put(KafkaMetadata.TOMBSTONE.key(), false);
        metadata.put(KafkaMetadata.EXACTLY_ONCE_SEMANTICS.key(), subscription.isEos());
        metadata.put(KafkaMetadata.CONSUMER_GROUP_ID.key(), subscription.getGroup());
        return Collections.unmodifiableMap(metadata);
    }

    private void commitPendingOffsets(boolean force) {
        if (pendingOffsets.isEmpty()) {
            return;
        }
        long now = clock.millis();
        if (force || now - lastOffsetCommit >= subscription.getOffsetCommitInterval().toMillis()) {
            // published records must be acknowledged before their input is marked consumed
            producer.flush();
            consumer.commitSync(pendingOffsets);
            logger.trace("Committed offsets {}", pendingOffsets);
            pendingOffsets.clear();
            lastOffsetCommit = now;
        }
    }

    private void rollbackConsumer(List<ConsumerRecord<String, M>> batch) {
        batch.stream().map(ConsumerRecord::offset).min(Long::compareTo)
                .ifPresent(offset -> consumer.seek(inputPartition, offset));
    }

    private void shutdown() {
        try {
            if (consumer != null && producer != null && !publisher.isTransactional()) {
                commitPendingOffsets(true);
            }
        } catch (KafkaException e) {
            logger.error("Error committing offsets for {} on shutdown", inputPartition, e);
        }
        try {
            if (consumer != null) {
                consumer.close();
            }
            if (producer != null) {
                producer.close();
            }
        } catch (KafkaException e) {
            logger.error("Error closing consumer/producer", e);
        }
    }
}
