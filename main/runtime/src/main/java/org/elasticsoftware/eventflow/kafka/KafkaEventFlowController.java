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
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.PartitionInfo;
import org.apache.kafka.common.TopicPartition;
import org.elasticsoftware.eventflow.dispatch.DispatchLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

/**
 * Starts a {@link KafkaPartitionProcessor} for every partition of the subscribed topics this instance
 * owns. Partitions are assigned statically, there is no group rebalancing. All processors share one
 * {@link DispatchLoop}, which serializes records for the same stream arriving on different partitions.
 */
public class KafkaEventFlowController<M, S> implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(KafkaEventFlowController.class);
    private final ConsumerFactory<String, M> consumerFactory;
    private final CustomKafkaProducerFactory<String, Object> producerFactory;
    private final DispatchLoop<M, S> dispatchLoop;
    private final KafkaSubscriptionConfiguration<M> subscription;
    private final KafkaPublisherConfiguration publisher;
    private final StreamIdResolver<M> streamIdResolver;
    private final ProcessingFailureHandler<M> failureHandler;
    private final Predicate<TopicPartition> ownedPartitions;
    private final ExecutorService executorService;
    private final List<KafkaPartitionProcessor<M, S>> processors = new ArrayList<>();

    public KafkaEventFlowController(ConsumerFactory<String, M> consumerFactory,
                                    CustomKafkaProducerFactory<String, Object> producerFactory,
                                    DispatchLoop<M, S> dispatchLoop,
                                    KafkaSubscriptionConfiguration<M> subscription,
                                    KafkaPublisherConfiguration publisher,
                                    StreamIdResolver<M> streamIdResolver,
                                    ProcessingFailureHandler<M> failureHandler,
                                    Predicate<TopicPartition> ownedPartitions) {
        this.consumerFactory = consumerFactory;
        this.producerFactory = producerFactory;
        this.dispatchLoop = dispatchLoop;
        this.subscription = subscription;
        this.publisher = publisher;
        this.streamIdResolver = streamIdResolver;
        this.failureHandler = failureHandler;
        this.ownedPartitions = ownedPartitions;
        this.executorService = Executors.newCachedThreadPool(
                new CustomizableThreadFactory(dispatchLoop.getAggregatorName() + "PartitionProcessorThread-"));
    }

    /**
     * Owns every partition in {@code partitions}, or all partitions when the set is empty.
     */
    public static Predicate<TopicPartition> partitions(Set<Integer> partitions) {
        return topicPartition -> partitions.isEmpty() || partitions.contains(topicPartition.partition());
    }

    public synchronized void start() {
        if (!processors.isEmpty()) {
            throw new IllegalStateException("KafkaEventFlowController already started");
        }
        List<TopicPartition> topicPartitions = discoverPartitions();
        logger.info("Starting {} KafkaPartitionProcessors for {}", topicPartitions.size(), dispatchLoop.getAggregatorName());
        for (TopicPartition topicPartition : topicPartitions) {
            KafkaPartitionProcessor<M, S> processor = new KafkaPartitionProcessor<>(consumerFactory, producerFactory,
                    dispatchLoop, subscription, publisher, topicPartition, streamIdResolver, failureHandler, Clock.systemUTC());
            processors.add(processor);
            executorService.submit(processor);
        }
    }

    public synchronized List<KafkaPartitionProcessor<M, S>> getProcessors() {
        return Collections.unmodifiableList(new ArrayList<>(processors));
    }

    private List<TopicPartition> discoverPartitions() {
        List<TopicPartition> topicPartitions = new ArrayList<>();
        try (Consumer<String, M> metadataConsumer = consumerFactory.createConsumer(subscription.getGroup(),
                subscription.getGroup() + "-metadata", null)) {
            for (KafkaTopic topic : subscription.getTopics()) {
                List<PartitionInfo> partitionInfos = metadataConsumer.partitionsFor(topic.name());
                if (partitionInfos == null || partitionInfos.isEmpty()) {
                    throw new IllegalStateException("Topic " + topic.name() + " does not exist");
                }
                partitionInfos.stream()
                        .map(partitionInfo -> new TopicPartition(partitionInfo.topic(), partitionInfo.partition()))
                        .filter(ownedPartitions)
                        .forEach(topicPartitions::add);
            }
        } catch (KafkaException e) {
            throw new IllegalStateException("Unable to discover partitions for consumer group " + subscription.getGroup(), e);
        }
        return topicPartitions;
    }

    @Override
    public synchronized void close() throws InterruptedException {
        logger.info("Closing {} KafkaPartitionProcessors", processors.size());
        for (KafkaPartitionProcessor<M, S> processor : processors) {
            try {
                processor.close();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw e;
            } catch (Exception e) {
                logger.error("Error closing KafkaPartitionProcessor for " + processor.getInputPartition(), e);
            }
        }
        executorService.shutdown();
        if (!executorService.awaitTermination(10, TimeUnit.SECONDS)) {
            logger.warn("KafkaPartitionProcessors did not shut down within 10 seconds");
        }
    }
}
