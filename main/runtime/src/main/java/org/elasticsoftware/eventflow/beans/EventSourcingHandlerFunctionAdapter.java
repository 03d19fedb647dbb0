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
import org.elasticsoftware.eventflow.aggregate.DomainEventType;
import org.elasticsoftware.eventflow.aggregate.EventSourcingHandlerFunction;
import org.elasticsoftware.eventflow.events.DomainEvent;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

/**
 * Invokes a handler method on an aggregator instance. Handlers may return the next state, return
 * nothing after mutating the state in place, or return a {@link CompletionStage} of the next state
 * which is awaited before the next event is applied.
 */
public class EventSourcingHandlerFunctionAdapter<S, E extends DomainEvent> implements EventSourcingHandlerFunction<S, E> {
    private final Aggregator<S> aggregator;
    private final Method adapterMethod;
    private final DomainEventType<E> domainEventType;
    private final ReturnKind returnKind;

    enum ReturnKind {
        STATE,
        VOID,
        ASYNC
    }

    public EventSourcingHandlerFunctionAdapter(Aggregator<S> aggregator,
                                               Method adapterMethod,
                                               DomainEventType<E> domainEventType) {
        this.aggregator = aggregator;
        this.adapterMethod = adapterMethod;
        this.domainEventType = domainEventType;
        this.returnKind = resolveReturnKind(adapterMethod, aggregator.getStateClass());
        // aggregators are often package private classes
        this.adapterMethod.trySetAccessible();
    }

    static ReturnKind resolveReturnKind(Method method, Class<?> stateClass) {
        Class<?> returnType = method.getReturnType();
        if (returnType == void.class) {
            return ReturnKind.VOID;
        } else if (CompletionStage.class.isAssignableFrom(returnType)) {
            return ReturnKind.ASYNC;
        } else if (stateClass.isAssignableFrom(returnType)) {
            return ReturnKind.STATE;
        }
        throw new IllegalStateException("Event sourcing handler " + method.getDeclaringClass().getName() + "." +
                method.getName() + " must return " + stateClass.getSimpleName() + ", void or a CompletionStage");
    }

    @Override
    @SuppressWarnings("unchecked")
    public @NotNull S apply(@NotNull E event, @NotNull S state) {
        Object result = invoke(event, state);
        return switch (returnKind) {
            case VOID -> state;
            case STATE -> (S) result;
            case ASYNC -> await((CompletionStage<S>) result);
        };
    }

    private Object invoke(E event, S state) {
        try {
            return adapterMethod.invoke(aggregator, event, state);
        } catch (IllegalAccessException e) {
            throw new RuntimeException(e);
        } catch (InvocationTargetException e) {
            if (e.getCause() != null) {
                if (e.getCause() instanceof RuntimeException) {
                    throw (RuntimeException) e.getCause();
                } else {
                    throw new RuntimeException(e.getCause());
                }
            } else {
                throw new RuntimeException(e);
            }
        }
    }

    private S await(CompletionStage<S> stage) {
        if (stage == null) {
            throw new IllegalStateException("Event sourcing handler " + adapterMethod.getName() + " returned a null CompletionStage");
        }
        try {
            return stage.toCompletableFuture().join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    public DomainEventType<E> getEventType() {
        return domainEventType;
    }

    public Aggregator<S> getAggregator() {
        return aggregator;
    }
}
