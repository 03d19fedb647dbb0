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

package org.elasticsoftware.eventflow.dispatch;

import org.apache.kafka.common.utils.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Routes every stream to one of a fixed number of single-threaded workers using the same hash Kafka
 * uses to partition keyed records. Messages for one stream are dispatched in submission order and
 * never concurrently, different streams run in parallel.
 */
public class PartitionedDispatcher<M, S> implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PartitionedDispatcher.class);
    private final DispatchLoop<M, S> dispatchLoop;
    private final ExecutorService[] workers;

    public PartitionedDispatcher(DispatchLoop<M, S> dispatchLoop, int partitions) {
        if (partitions <= 0) {
            throw new IllegalArgumentException("Number of partitions must be positive, got " + partitions);
        }
        this.dispatchLoop = dispatchLoop;
        this.workers = new ExecutorService[partitions];
        for (int i = 0; i < partitions; i++) {
            workers[i] = Executors.newSingleThreadExecutor(
                    new CustomizableThreadFactory(dispatchLoop.getAggregatorName() + "DispatchThread-" + i + "-"));
        }
    }

    public CompletableFuture<DispatchResult<S>> dispatch(String streamId, M message) {
        return dispatch(streamId, message, Map.of());
    }

    public CompletableFuture<DispatchResult<S>> dispatch(String streamId, M message, Map<String, Object> metadata) {
        return CompletableFuture.supplyAsync(() -> dispatchLoop.dispatch(streamId, message, metadata),
                workers[partitionFor(streamId)]);
    }

    public int partitionFor(String streamId) {
        return Utils.toPositive(Utils.murmur2(streamId.getBytes(StandardCharsets.UTF_8))) % workers.length;
    }

    public int getPartitions() {
        return workers.length;
    }

    @Override
    public void close() {
        for (ExecutorService worker : workers) {
            worker.shutdown();
        }
        try {
            for (ExecutorService worker : workers) {
                if (!worker.awaitTermination(10, TimeUnit.SECONDS)) {
                    logger.warn("Dispatch worker did not terminate within 10 seconds, forcing shutdown");
                    worker.shutdownNow();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            for (ExecutorService worker : workers) {
                worker.shutdownNow();
            }
        }
    }
}
