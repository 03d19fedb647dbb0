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

import java.util.Objects;
import java.util.Optional;

public final class KafkaPublisherConfiguration {
    public static final int DEFAULT_MAXIMUM_BATCH_SIZE = 1000;

    private final String defaultTopic;
    private final int maximumBatchSize;
    private final KafkaMessagePublishingStrategy messagePublishingStrategy;
    private final String transactionalId;
    private final KafkaHeaderNames headerNames;

    private KafkaPublisherConfiguration(Builder builder) {
        if (builder.maximumBatchSize <= 0) {
            throw new IllegalArgumentException("maximumBatchSize must be positive, got " + builder.maximumBatchSize);
        }
        if (builder.messagePublishingStrategy != KafkaMessagePublishingStrategy.NON_TRANSACTIONAL
                && (builder.transactionalId == null || builder.transactionalId.isBlank())) {
            throw new IllegalArgumentException("A transactionalId is required for the " +
                    builder.messagePublishingStrategy + " publishing strategy");
        }
        this.defaultTopic = builder.defaultTopic;
        this.maximumBatchSize = builder.maximumBatchSize;
        this.messagePublishingStrategy = builder.messagePublishingStrategy;
        this.transactionalId = builder.transactionalId;
        this.headerNames = builder.headerNames;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<String> getDefaultTopic() {
        return Optional.ofNullable(defaultTopic);
    }

    public int getMaximumBatchSize() {
        return maximumBatchSize;
    }

    public KafkaMessagePublishingStrategy getMessagePublishingStrategy() {
        return messagePublishingStrategy;
    }

    public boolean isTransactional() {
        return messagePublishingStrategy != KafkaMessagePublishingStrategy.NON_TRANSACTIONAL;
    }

    public String getTransactionalId() {
        return transactionalId;
    }

    /**
     * Every input partition gets its own producer, the id must be the same across restarts for the
     * broker to fence out zombie instances.
     */
    public String transactionalIdFor(String topic, int partition) {
        return transactionalId + "-" + topic + "-" + partition;
    }

    public KafkaHeaderNames getHeaderNames() {
        return headerNames;
    }

    public static final class Builder {
        private String defaultTopic;
        private int maximumBatchSize = DEFAULT_MAXIMUM_BATCH_SIZE;
        private KafkaMessagePublishingStrategy messagePublishingStrategy = KafkaMessagePublishingStrategy.NON_TRANSACTIONAL;
        private String transactionalId;
        private KafkaHeaderNames headerNames = KafkaHeaderNames.DEFAULT;

        private Builder() {
        }

        public Builder withDefaultTopic(String defaultTopic) {
            this.defaultTopic = defaultTopic;
            return this;
        }

        public Builder withMaximumBatchSize(int maximumBatchSize) {
            this.maximumBatchSize = maximumBatchSize;
            return this;
        }

        public Builder withMessagePublishingStrategy(KafkaMessagePublishingStrategy messagePublishingStrategy) {
            this.messagePublishingStrategy = Objects.requireNonNull(messagePublishingStrategy);
            return this;
        }

        public Builder withTransactionalId(String transactionalId) {
            this.transactionalId = transactionalId;
            return this;
        }

        public Builder withHeaderNames(KafkaHeaderNames headerNames) {
            this.headerNames = Objects.requireNonNull(headerNames);
            return this;
        }

        public KafkaPublisherConfiguration build() {
            return new KafkaPublisherConfiguration(this);
        }
    }
}
