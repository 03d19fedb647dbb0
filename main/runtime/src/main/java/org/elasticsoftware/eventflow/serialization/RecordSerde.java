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

package org.elasticsoftware.eventflow.serialization;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.serialization.Deserializer;
import org.apache.kafka.common.serialization.Serde;
import org.apache.kafka.common.serialization.Serializer;

import java.io.IOException;

/**
 * JSON serde for the protocol records, binary payloads are written as base64.
 */
public final class RecordSerde<T> implements Serde<T> {
    private final ObjectMapper objectMapper;
    private final Class<T> recordClass;
    private final Serializer<T> serializer;
    private final Deserializer<T> deserializer;

    public RecordSerde(ObjectMapper objectMapper, Class<T> recordClass) {
        this.objectMapper = objectMapper;
        this.recordClass = recordClass;
        this.serializer = new RecordSerializer();
        this.deserializer = new RecordDeserializer();
    }

    @Override
    public Serializer<T> serializer() {
        return serializer;
    }

    @Override
    public Deserializer<T> deserializer() {
        return deserializer;
    }

    private final class RecordSerializer implements Serializer<T> {
        @Override
        public byte[] serialize(String topic, T data) {
            if (data == null) {
                return null;
            }
            try {
                return objectMapper.writeValueAsBytes(data);
            } catch (IOException e) {
                throw new SerializationException("Failed to serialize " + recordClass.getSimpleName(), e);
            }
        }
    }

    private final class RecordDeserializer implements Deserializer<T> {
        @Override
        public T deserialize(String topic, byte[] data) {
            if (data == null) {
                return null;
            }
            try {
                return objectMapper.readValue(data, recordClass);
            } catch (IOException e) {
                throw new SerializationException("Failed to deserialize " + recordClass.getSimpleName(), e);
            }
        }
    }
}
