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

import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.elasticsoftware.eventflow.dispatch.DispatchLoop;
import org.elasticsoftware.eventflow.store.InMemoryEventStore;
import org.elasticsoftware.eventflowtest.counter.CounterChanged;
import org.elasticsoftware.eventflowtest.counter.CounterCommand;
import org.elasticsoftware.eventflowtest.counter.CounterCommandHandler;
import org.elasticsoftware.eventflowtest.counter.CounterFixtures;
import org.elasticsoftware.eventflowtest.counter.CounterState;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.support.serializer.JsonDeserializer;
import org.springframework.kafka.support.serializer.JsonSerializer;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.elasticsoftware.eventflowtest.counter.CounterFixtures.OBJECT_MAPPER;
import static org.junit.jupiter.api.Assertions.*;

@Testcontainers(disabledWithoutDocker = true)
class KafkaEventFlowControllerTest {
    private static final String CONFLUENT_PLATFORM_VERSION = "7.8.1";
    private static final String COMMANDS = "Counter-Commands";
    private static final String EVENTS = "Counter-Events";

    @Container
    private static final KafkaContainer kafka =
            new KafkaContainer(DockerImageName.parse("confluentinc/cp-kafka:" + CONFLUENT_PLATFORM_VERSION))
                    .withKraft()
                    .withEnv("KAFKA_AUTO_CREATE_TOPICS_ENABLE", "false");

    @BeforeAll
    static void createTopics() throws Exception {
        try (AdminClient adminClient = AdminClient.create(Map.of(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers()))) {
            adminClient.createTopics(List.of(
                    new NewTopic(COMMANDS, 2, (short) 1),
                    new NewTopic(EVENTS, 1, (short) 1))).all().get();
        }
    }

    @Test
    void testExactlyOnceRoundTrip() throws Exception {
        CustomKafkaConsumerFactory<String, CounterCommand> consumerFactory = new CustomKafkaConsumerFactory<>(
                Map.of(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers()),
                new StringDeserializer(),
                new JsonDeserializer<>(CounterCommand.class, OBJECT_MAPPER, false));
        CustomKafkaProducerFactory<String, Object> producerFactory = new CustomKafkaProducerFactory<>(
                Map.of(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers()),
                new StringSerializer(),
                new JsonSerializer<Object>(OBJECT_MAPPER).noTypeInfo());
        DispatchLoop<CounterCommand, CounterState> dispatchLoop =
                DispatchLoop.<CounterCommand, CounterState>builder(CounterFixtures.counterRuntime(), new InMemoryEventStore())
                        .withHandler(new CounterCommandHandler())
                        .build();
        KafkaSubscriptionConfiguration<CounterCommand> subscription = KafkaSubscriptionConfiguration.<CounterCommand>builder("counters")
                .withTopic(new KafkaTopic(COMMANDS, KafkaOffsetResetStrategy.EARLIEST))
                .withEos(true)
                .build();
        KafkaPublisherConfiguration publisher = KafkaPublisherConfiguration.builder()
                .withDefaultTopic(EVENTS)
                .withMessagePublishingStrategy(KafkaMessagePublishingStrategy.EXACTLY_ONCE_SEMANTICS)
                .withTransactionalId("counters")
                .build();

        try (KafkaProducer<String, String> commandProducer = new KafkaProducer<>(
                Map.of(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers()),
                new StringSerializer(), new StringSerializer())) {
            commandProducer.send(new ProducerRecord<>(COMMANDS, "123", "{\"delta\":5}")).get();
            commandProducer.send(new ProducerRecord<>(COMMANDS, "123", "{\"delta\":3}")).get();
            commandProducer.send(new ProducerRecord<>(COMMANDS, "456", "{\"delta\":-1}")).get();
        }

        KafkaEventFlowController<CounterCommand, CounterState> controller = new KafkaEventFlowController<>(
                consumerFactory, producerFactory, dispatchLoop, subscription, publisher,
                StreamIdResolver.recordKey(), ProcessingFailureHandler.skip(), KafkaEventFlowController.partitions(Set.of()));
        List<CounterChanged> changes = new ArrayList<>();
        try {
            controller.start();
            assertEquals(2, controller.getProcessors().size());

            try (KafkaConsumer<String, String> eventConsumer = new KafkaConsumer<>(
                    Map.of(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers(),
                            ConsumerConfig.ISOLATION_LEVEL_CONFIG, "read_committed"),
                    new StringDeserializer(), new StringDeserializer())) {
                TopicPartition events = new TopicPartition(EVENTS, 0);
                eventConsumer.assign(List.of(events));
                eventConsumer.seekToBeginning(List.of(events));
                long deadline = System.currentTimeMillis() + 60_000L;
                while (changes.size() < 3 && System.currentTimeMillis() < deadline) {
                    for (ConsumerRecord<String, String> consumerRecord : eventConsumer.poll(Duration.ofMillis(250))) {
                        changes.add(OBJECT_MAPPER.readValue(consumerRecord.value(), CounterChanged.class));
                    }
                }
            }
        } finally {
            controller.close();
        }

        assertEquals(3, changes.size());
        assertTrue(changes.contains(new CounterChanged("123", 8L)));
        assertTrue(changes.contains(new CounterChanged("456", -1L)));
        controller.getProcessors().forEach(processor ->
                assertEquals(PartitionProcessorState.SHUTTING_DOWN, processor.getProcessState()));
    }
}
