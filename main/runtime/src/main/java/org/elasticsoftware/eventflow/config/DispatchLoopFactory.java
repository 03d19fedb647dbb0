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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.elasticsoftware.eventflow.aggregate.Aggregator;
import org.elasticsoftware.eventflow.aggregate.AggregatorRuntime;
import org.elasticsoftware.eventflow.beans.AggregatorScanner;
import org.elasticsoftware.eventflow.dispatch.CommitMode;
import org.elasticsoftware.eventflow.dispatch.DispatchLoop;
import org.elasticsoftware.eventflow.dispatch.PartitionedDispatcher;
import org.elasticsoftware.eventflow.dispatch.RetryPolicy;
import org.elasticsoftware.eventflow.handlers.MessageHandler;
import org.elasticsoftware.eventflow.snapshot.SnapshotPolicy;
import org.elasticsoftware.eventflow.snapshot.SnapshotStore;
import org.elasticsoftware.eventflow.store.EventStore;

/**
 * Creates dispatch loops for aggregators against the configured stores and policies.
 */
public class DispatchLoopFactory {
    private final ObjectMapper objectMapper;
    private final EventStore eventStore;
    private final SnapshotStore snapshotStore;
    private final RetryPolicy retryPolicy;
    private final SnapshotPolicy snapshotPolicy;
    private final CommitMode commitMode;
    private final int partitions;

    public DispatchLoopFactory(ObjectMapper objectMapper,
                               EventStore eventStore,
                               SnapshotStore snapshotStore,
                               RetryPolicy retryPolicy,
                               SnapshotPolicy snapshotPolicy,
                               CommitMode commitMode,
                               int partitions) {
        this.objectMapper = objectMapper;
        this.eventStore = eventStore;
        this.snapshotStore = snapshotStore;
        this.retryPolicy = retryPolicy;
        this.snapshotPolicy = snapshotPolicy;
        this.commitMode = commitMode;
        this.partitions = partitions;
    }

    public <M, S> DispatchLoop<M, S> create(Aggregator<S> aggregator, MessageHandler<M, S> handler) {
        return create(AggregatorScanner.scan(aggregator, objectMapper), handler);
    }

    public <M, S> DispatchLoop<M, S> create(AggregatorRuntime<S> runtime, MessageHandler<M, S> handler) {
        return DispatchLoop.<M, S>builder(runtime, eventStore)
                .withHandler(handler)
                .withSnapshotStore(snapshotStore)
                .withSnapshotPolicy(snapshotPolicy)
                .withRetryPolicy(retryPolicy)
                .withCommitMode(commitMode)
                .build();
    }

    /**
     * The returned dispatcher owns worker threads and must be closed.
     */
    public <M, S> PartitionedDispatcher<M, S> createPartitioned(Aggregator<S> aggregator, MessageHandler<M, S> handler) {
        return new PartitionedDispatcher<>(create(aggregator, handler), partitions);
    }
}
