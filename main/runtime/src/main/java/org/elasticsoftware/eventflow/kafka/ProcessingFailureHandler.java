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

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.elasticsoftware.eventflow.EventFlowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides what happens to a record whose dispatch failed for good: retries were exhausted, the handler
 * threw, or the store stayed unavailable.
 */
@FunctionalInterface
public interface ProcessingFailureHandler<M> {
    enum Action {
        /**
         * Commit past the record and continue with the next one.
         */
        SKIP,
        /**
         * Leave the record uncommitted and stop the partition.
         */
        SHUTDOWN
    }

    Action onFailure(ConsumerRecord<String, M> consumerRecord, EventFlowException failure);

    static <M> ProcessingFailureHandler<M> skip() {
        Logger logger = LoggerFactory.getLogger(ProcessingFailureHandler.class);
        return (consumerRecord, failure) -> {
            logger.error("Skipping record at offset {} of {}-{} for stream {}", consumerRecord.offset(),
                    consumerRecord.topic(), consumerRecord.partition(), failure.getStreamId(), failure);
            return Action.SKIP;
        };
    }

    static <M> ProcessingFailureHandler<M> shutdown() {
        return (consumerRecord, failure) -> Action.SHUTDOWN;
    }
}
