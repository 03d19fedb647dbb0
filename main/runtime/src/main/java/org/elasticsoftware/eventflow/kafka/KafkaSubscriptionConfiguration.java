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

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public final class KafkaSubscriptionConfiguration<M> {
    public static final Duration DEFAULT_CONSUME_TIMEOUT = Duration.ofMillis(50);
    public static final Duration DEFAULT_OFFSET_COMMIT_INTERVAL = Duration.ofMillis(5000);

    private final String group;
    private final List<KafkaTopic> topics;
    private final boolean eos;
    private final Duration consumeTimeout;
    private final Integer maxBytesPerPartition;
    private final Duration offsetCommitInterval;
    private final KafkaMessagePreprocessor<M> preprocessor;

    private KafkaSubscriptionConfiguration(Builder<M> builder) {
        if (builder.group == null || builder.group.isBlank()) {
            throw new IllegalArgumentException("Consumer group must not be blank");
        }
        if (builder.topics.isEmpty()) {
            throw new IllegalArgumentException("At least one topic is required for consumer group " + builder.group);
        }
        if (builder.maxBytesPerPartition != null && builder.maxBytesPerPartition <= 0) {
            throw new IllegalArgumentException("maxBytesPerPartition must be positive, got " + builder.maxBytesPerPartition);
        }
        this.group = builder.group;
        this.topics = List.copyOf(builder.topics);
        this.eos = builder.eos;
        this.consumeTimeout = builder.consumeTimeout;
        this.maxBytesPerPartition = builder.maxBytesPerPartition;
        this.offsetCommitInterval = builder.offsetCommitInterval;
        this.preprocessor = builder.preprocessor;
    }

    public static <M> Builder<M> builder(String group) {
        return new Builder<>(group);
    }

    public String getGroup() {
        return group;
    }

    public List<KafkaTopic> getTopics() {
        return topics;
    }

    public Optional<KafkaTopic> getTopic(String name) {
        return topics.stream().filter(topic -> topic.name().equals(name)).findFirst();
    }

    public boolean isEos() {
        return eos;
    }

    public Duration getConsumeTimeout() {
        return consumeTimeout;
    }

    public Optional<Integer> getMaxBytesPerPartition() {
        return Optional.ofNullable(maxBytesPerPartition);
    }

    public Duration getOffsetCommitInterval() {
        return offsetCommitInterval;
    }

    public KafkaMessagePreprocessor<M> getPreprocessor() {
        return preprocessor;
    }

    public static final class Builder<M> {
        private final String group;
        private final List<KafkaTopic> topics = new ArrayList<>();
        private boolean eos = false;
        private Duration consumeTimeout = DEFAULT_CONSUME_TIMEOUT;
        private Integer maxBytesPerPartition;
        private Duration offsetCommitInterval = DEFAULT_OFFSET_COMMIT_INTERVAL;
        private KafkaMessagePreprocessor<M> preprocessor = KafkaMessagePreprocessor.identity();

        private Builder(String group) {
            this.group = group;
        }

        public Builder<M> withTopic(String name) {
            return withTopic(KafkaTopic.of(name));
        }

        public Builder<M> withTopic(KafkaTopic topic) {
            topics.add(Objects.requireNonNull(topic));
            return this;
        }

        public Builder<M> withEos(boolean eos) {
            this.eos = eos;
            return this;
        }

        public Builder<M> withConsumeTimeout(Duration consumeTimeout) {
            this.consumeTimeout = Objects.requireNonNull(consumeTimeout);
            return this;
        }

        public Builder<M> withMaxBytesPerPartition(Integer maxBytesPerPartition) {
            this.maxBytesPerPartition = maxBytesPerPartition;
            return this;
        }

        public Builder<M> withOffsetCommitInterval(Duration offsetCommitInterval) {
            this.offsetCommitInterval = Objects.requireNonNull(offsetCommitInterval);
            return this;
        }

        public Builder<M> withPreprocessor(KafkaMessagePreprocessor<M> preprocessor) {
            this.preprocessor = Objects.requireNonNull(preprocessor);
            return this;
        }

        public KafkaSubscriptionConfiguration<M> build() {
            return new KafkaSubscriptionConfiguration<>(this);
        }
    }
}
