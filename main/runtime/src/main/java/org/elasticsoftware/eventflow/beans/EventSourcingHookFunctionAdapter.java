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

package org.elasticsoftware.eventflow.beans;

import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.eventflow.aggregate.Aggregator;
import org.elasticsoftware.eventflow.aggregate.EventSourcingHookFunction;
import org.elasticsoftware.eventflow.events.DomainEvent;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

/**
 * Invokes a {@code before} or {@code after} method on an aggregator instance. A returned
 * {@link CompletionStage} is awaited, its value is ignored.
 */
public class EventSourcingHookFunctionAdapter<S> implements EventSourcingHookFunction<S> {
    private final Aggregator<S> aggregator;
    private final Method adapterMethod;
    private final boolean async;

    public EventSourcingHookFunctionAdapter(Aggregator<S> aggregator, Method adapterMethod) {
        this.aggregator = aggregator;
        this.adapterMethod = adapterMethod;
        this.async = CompletionStage.class.isAssignableFrom(adapterMethod.getReturnType());
        this.adapterMethod.trySetAccessible();
    }

    @Override
    public void accept(@NotNull DomainEvent event, @NotNull S state) {
        Object result;
        try {
            result = adapterMethod.invoke(aggregator, event, state);
        } catch (IllegalAccessException e) {
            throw new RuntimeException(e);
        } catch (InvocationTargetException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new RuntimeException(e.getCause() != null ? e.getCause() : e);
        }
        if (async && result != null) {
            try {
                ((CompletionStage<?>) result).toCompletableFuture().join();
            } catch (CompletionException e) {
                if (e.getCause() instanceof RuntimeException) {
                    throw (RuntimeException) e.getCause();
                }
                throw e;
            }
        }
    }

    public Method getAdapterMethod() {
        return adapterMethod;
    }
}
