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
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.errors.ApiException;
import org.apache.kafka.common.header.internals.RecordHeaders;
import org.elasticsoftware.eventflow.annotations.DomainEventInfo;
import org.elasticsoftware.eventflow.handlers.PublishedMessage;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

public final class KafkaSender {

    private KafkaSender() {
        // Utility class
    }

    /**
     * Sends the record and rethrows the failure right away when the producer failed the send synchronously.
     */
    public static <K, V> Future<RecordMetadata> send(Producer<K, V> producer, ProducerRecord<K, V> producerRecord) {
        Future<RecordMetadata> future = producer.send(producerRecord);
        if (future.isDone()) {
            try {
                future.get();
            } catch (InterruptedException ignored) {
                // a future that isDone() cannot throw InterruptedException
            } catch (ExecutionException e) {
                if (e.getCause() instanceof ApiException apiException) {
                    throw apiException;
                } else if (e.getCause() instanceof RuntimeException runtimeException) {
                    throw runtimeException;
                } else {
                    throw new IllegalStateException(e.getCause());
                }
            }
        }
        return future;
    }

    /**
     * Builds the record for a message published by a handler. The message is keyed by its own key, or
     * the stream it was published from.
     */
    public static ProducerRecord<String, Object> toProducerRecord(PublishedMessage message,
                                                                  String defaultTopic,
                                                                  KafkaHeaderNames headerNames,
                                                                  String streamId,
                                                                  long sequenceNumber,
                                                                  long timestamp) {
        String topic = message.topic() != null ? message.topic() : defaultTopic;
        if (topic == null) {
            throw new IllegalStateException("No topic for message of type " +
                    message.payload().getClass().getName() + " and no default topic configured");
        }
        String key = message.key() != null ? message.key() : streamId;
        RecordHeaders headers = new RecordHeaders();
        headers.add(headerNames.eventType(), utf8(messageType(message.payload())));
        headers.add(headerNames.stream(), utf8(streamId));
        headers.add(headerNames.sequenceNumber(), utf8(Long.toString(sequenceNumber)));
        headers.add(headerNames.timestamp(), utf8(Long.toString(timestamp)));
        headers.add(headerNames.contentType(), utf8(message.payload().getClass().getName()));
        return new ProducerRecord<>(topic, null, timestamp, key, message.payload(), headers);
    }

    static String messageType(Object payload) {
        DomainEventInfo info = payload.getClass().getAnnotation(DomainEventInfo.class);
        return info != null ? info.type() : payload.getClass().getSimpleName();
    }

    private static byte[] utf8(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
