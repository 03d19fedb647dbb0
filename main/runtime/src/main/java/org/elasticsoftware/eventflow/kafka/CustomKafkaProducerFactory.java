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

import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.serialization.Serializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.ProducerFactory;

import java.util.Map;

/**
 * Creates the producer of one input partition. Transactional producers get the id
 * {@link KafkaPublisherConfiguration#transactionalIdFor(String, int)} of their partition as complete
 * transactional id, without the suffix spring appends to a prefix, so the id is stable across restarts
 * and a restarted instance fences out the previous owner of the partition.
 */
public class CustomKafkaProducerFactory<K, V> extends DefaultKafkaProducerFactory<K, V> {
    private static final Logger logger = LoggerFactory.getLogger(CustomKafkaProducerFactory.class);

    public CustomKafkaProducerFactory(Map<String, Object> configs, Serializer<K> keySerializer, Serializer<V> valueSerializer) {
        super(configs, keySerializer, valueSerializer);
    }

    public Producer<K, V> createPartitionProducer(KafkaPublisherConfiguration publisher, TopicPartition inputPartition) {
        if (!publisher.isTransactional()) {
            return createProducer();
        }
        return createProducer(publisher.transactionalIdFor(inputPartition.topic(), inputPartition.partition()));
    }

    @Override
    protected Producer<K, V> createTransactionalProducer(String transactionalId) {
        Producer<K, V> newProducer = createRawProducer(getTxProducerConfigs(transactionalId));
        try {
            // fences any producer still using this id and aborts its open transaction
            newProducer.initTransactions();
        } catch (RuntimeException e) {
            try {
                newProducer.close(ProducerFactory.DEFAULT_PHYSICAL_CLOSE_TIMEOUT);
            } catch (RuntimeException closeException) {
                e.addSuppressed(closeException);
            }
            throw new KafkaException("Unable to initialize transactional producer " + transactionalId, e);
        }
        logger.debug("Initialized transactional producer {}", transactionalId);
        return newProducer;
    }
}
