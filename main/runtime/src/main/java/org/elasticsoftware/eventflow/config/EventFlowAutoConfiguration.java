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

package org.elasticsoftware.eventflow.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.elasticsoftware.eventflow.dispatch.CommitMode;
import org.elasticsoftware.eventflow.dispatch.RetryPolicy;
import org.elasticsoftware.eventflow.kafka.CustomKafkaConsumerFactory;
import org.elasticsoftware.eventflow.kafka.CustomKafkaProducerFactory;
import org.elasticsoftware.eventflow.kafka.KafkaMessagePublishingStrategy;
import org.elasticsoftware.eventflow.kafka.KafkaPublisherConfiguration;
import org.elasticsoftware.eventflow.protocol.DomainEventRecord;
import org.elasticsoftware.eventflow.protocol.SnapshotRecord;
import org.elasticsoftware.eventflow.serialization.RecordSerde;
import org.elasticsoftware.eventflow.snapshot.InMemorySnapshotStore;
import org.elasticsoftware.eventflow.snapshot.RocksDBSnapshotStore;
import org.elasticsoftware.eventflow.snapshot.SnapshotPolicy;
import org.elasticsoftware.eventflow.snapshot.SnapshotStore;
import org.elasticsoftware.eventflow.store.EventStore;
import org.elasticsoftware.eventflow.store.InMemoryEventStore;
import org.elasticsoftware.eventflow.store.RocksDBEventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.PropertySource;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.support.serializer.JsonDeserializer;
import org.springframework.kafka.support.serializer.JsonSerializer;

import java.time.Duration;
import java.util.Locale;

@AutoConfiguration
@EnableConfigurationProperties(KafkaProperties.class)
@PropertySource("classpath:eventflow-runtime.properties")
public class EventFlowAutoConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(EventFlowAutoConfiguration.class);

    @Bean(name = "eventFlowObjectMapper")
    @ConditionalOnMissingBean(ObjectMapper.class)
    public ObjectMapper objectMapper() {
        return new ObjectMapper().findAndRegisterModules();
    }

    @Bean(name = "eventFlowEventRecordSerde")
    public RecordSerde<DomainEventRecord> eventRecordSerde(ObjectMapper objectMapper) {
        return new RecordSerde<>(objectMapper, DomainEventRecord.class);
    }

    @Bean(name = "eventFlowSnapshotRecordSerde")
    public RecordSerde<SnapshotRecord> snapshotRecordSerde(ObjectMapper objectMapper) {
        return new RecordSerde<>(objectMapper, SnapshotRecord.class);
    }

    @Bean(name = "eventFlowEventStore", destroyMethod = "close")
    @ConditionalOnMissingBean(EventStore.class)
    public EventStore eventStore(@Value("${eventflow.rocksdb.baseDir:}") String baseDir,
                                 @Qualifier("eventFlowEventRecordSerde") RecordSerde<DomainEventRecord> serde) {
        if (baseDir.isBlank()) {
            logger.warn("No eventflow.rocksdb.baseDir configured, events are kept in memory only");
            return new InMemoryEventStore();
        }
        return new RocksDBEventStore(baseDir, "events", serde.serializer(), serde.deserializer());
    }

    @Bean(name = "eventFlowSnapshotStore", destroyMethod = "close")
    @ConditionalOnMissingBean(SnapshotStore.class)
    public SnapshotStore snapshotStore(@Value("${eventflow.rocksdb.baseDir:}") String baseDir,
                                       @Qualifier("eventFlowSnapshotRecordSerde") RecordSerde<SnapshotRecord> serde) {
        if (baseDir.isBlank()) {
            return new InMemorySnapshotStore();
        }
        return new RocksDBSnapshotStore(baseDir, "snapshots", serde.serializer(), serde.deserializer());
    }

    @Bean(name = "eventFlowRetryPolicy")
    @ConditionalOnMissingBean(RetryPolicy.class)
    public RetryPolicy retryPolicy(@Value("${eventflow.retry.maxConflictRetries}") int maxConflictRetries,
                                   @Value("${eventflow.retry.maxStorageRetries}") int maxStorageRetries,
                                   @Value("${eventflow.retry.initialBackoffMs}") long initialBackoffMs,
                                   @Value("${eventflow.retry.maxBackoffMs}") long maxBackoffMs,
                                   @Value("${eventflow.retry.multiplier}") double multiplier) {
        return new RetryPolicy(maxConflictRetries, maxStorageRetries,
                Duration.ofMillis(initialBackoffMs), Duration.ofMillis(maxBackoffMs), multiplier);
    }

    @Bean(name = "eventFlowSnapshotPolicy")
    @ConditionalOnMissingBean(SnapshotPolicy.class)
    public SnapshotPolicy snapshotPolicy(@Value("${eventflow.snapshot.frequency}") int frequency) {
        return frequency > 0 ? SnapshotPolicy.everyEvents(frequency) : SnapshotPolicy.never();
    }

    @Bean(name = "eventFlowDispatchLoopFactory")
    public DispatchLoopFactory dispatchLoopFactory(ObjectMapper objectMapper,
                                                   EventStore eventStore,
                                                   SnapshotStore snapshotStore,
                                                   RetryPolicy retryPolicy,
                                                   SnapshotPolicy snapshotPolicy,
                                                   @Value("${eventflow.dispatch.commitMode}") String commitMode,
                                                   @Value("${eventflow.dispatch.partitions}") int partitions) {
        return new DispatchLoopFactory(objectMapper, eventStore, snapshotStore, retryPolicy, snapshotPolicy,
                CommitMode.valueOf(commitMode.trim().toUpperCase(Locale.ROOT)), partitions);
    }

    @Bean(name = "eventFlowPublisherConfiguration")
    @ConditionalOnMissingBean(KafkaPublisherConfiguration.class)
    public KafkaPublisherConfiguration publisherConfiguration(
            @Value("${eventflow.kafka.messagePublishingStrategy}") String messagePublishingStrategy,
            @Value("${eventflow.kafka.transactionalId:}") String transactionalId,
            @Value("${eventflow.kafka.defaultTopic:}") String defaultTopic,
            @Value("${eventflow.kafka.maximumBatchSize}") int maximumBatchSize) {
        return KafkaPublisherConfiguration.builder()
                .withMessagePublishingStrategy(KafkaMessagePublishingStrategy.valueOf(
                        messagePublishingStrategy.trim().toUpperCase(Locale.ROOT)))
                .withTransactionalId(transactionalId.isBlank() ? null : transactionalId)
                .withDefaultTopic(defaultTopic.isBlank() ? null : defaultTopic)
                .withMaximumBatchSize(maximumBatchSize)
                .build();
    }

    @Bean(name = "eventFlowConsumerFactory")
    public ConsumerFactory<String, JsonNode> consumerFactory(KafkaProperties properties, ObjectMapper objectMapper) {
        return new CustomKafkaConsumerFactory<>(properties.buildConsumerProperties(null),
                new StringDeserializer(),
                new JsonDeserializer<>(JsonNode.class, objectMapper, false));
    }

    @Bean(name = "eventFlowProducerFactory")
    public CustomKafkaProducerFactory<String, Object> producerFactory(KafkaProperties properties, ObjectMapper objectMapper) {
        return new CustomKafkaProducerFactory<>(properties.buildProducerProperties(null),
                new StringSerializer(),
                new JsonSerializer<Object>(objectMapper).noTypeInfo());
    }
}
