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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.elasticsoftware.eventflow.aggregate.Aggregator;
import org.elasticsoftware.eventflow.aggregate.AggregatorRuntime;
import org.elasticsoftware.eventflow.aggregate.AggregatorRuntimeBuilder;
import org.elasticsoftware.eventflow.aggregate.DomainEventType;
import org.elasticsoftware.eventflow.annotations.AggregatorInfo;
import org.elasticsoftware.eventflow.annotations.DomainEventInfo;
import org.elasticsoftware.eventflow.annotations.EventSourcingHandler;
import org.elasticsoftware.eventflow.events.DomainEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.Comparator;
import java.util.concurrent.CompletionStage;

/**
 * Builds an {@link AggregatorRuntime} from an aggregator object. Handler methods are either annotated
 * with {@link EventSourcingHandler} or follow the {@code on<Type>(event, state)} naming convention.
 * Optional public {@code before(DomainEvent, state)} and {@code after(DomainEvent, state)} methods are
 * registered as hooks that run around every handler. The lookup happens once, at startup.
 */
public final class AggregatorScanner {
    private static final Logger logger = LoggerFactory.getLogger(AggregatorScanner.class);
    static final String BEFORE_HOOK = "before";
    static final String AFTER_HOOK = "after";

    private AggregatorScanner() {
    }

    public static <S> AggregatorRuntime<S> scan(Aggregator<S> aggregator, ObjectMapper objectMapper) {
        return builder(aggregator).withObjectMapper(objectMapper).build();
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    public static <S> AggregatorRuntimeBuilder<S> builder(Aggregator<S> aggregator) {
        Class<S> stateClass = aggregator.getStateClass();
        AggregatorRuntimeBuilder<S> builder = AggregatorRuntimeBuilder.builder(aggregator.getName(), stateClass)
                .withInitialState(aggregator::initialState);
        // stable registration order
        Arrays.stream(aggregator.getClass().getMethods())
                .sorted(Comparator.comparing(Method::getName))
                .filter(method -> isEventSourcingHandler(method, stateClass))
                .forEach(method -> {
                    Class<? extends DomainEvent> eventClass = (Class<? extends DomainEvent>) method.getParameterTypes()[0];
                    DomainEventType eventType = DomainEventType.of(eventClass);
                    logger.debug("Registering {}.{} as handler for {} in aggregator {}",
                            aggregator.getClass().getSimpleName(), method.getName(), eventType.typeName(), aggregator.getName());
                    builder.withEventSourcingHandler(eventType,
                            new EventSourcingHandlerFunctionAdapter<>(aggregator, method, eventType));
                });
        Arrays.stream(aggregator.getClass().getMethods())
                .filter(method -> isHook(method, BEFORE_HOOK, stateClass))
                .forEach(method -> builder.withBeforeHook(new EventSourcingHookFunctionAdapter<>(aggregator, method)));
        Arrays.stream(aggregator.getClass().getMethods())
                .filter(method -> isHook(method, AFTER_HOOK, stateClass))
                .forEach(method -> builder.withAfterHook(new EventSourcingHookFunctionAdapter<>(aggregator, method)));
        AggregatorInfo info = aggregator.getClass().getAnnotation(AggregatorInfo.class);
        if (info != null) {
            Arrays.stream(info.requiredEvents()).forEach(builder::withRequiredEvent);
        }
        return builder;
    }

    static boolean isEventSourcingHandler(Method method, Class<?> stateClass) {
        if (Modifier.isStatic(method.getModifiers()) || method.isBridge() || method.isSynthetic()) {
            return false;
        }
        boolean annotated = method.isAnnotationPresent(EventSourcingHandler.class);
        Class<?>[] parameterTypes = method.getParameterTypes();
        boolean signatureMatches = parameterTypes.length == 2
                && DomainEvent.class.isAssignableFrom(parameterTypes[0])
                && parameterTypes[0].isAnnotationPresent(DomainEventInfo.class)
                && parameterTypes[1].isAssignableFrom(stateClass);
        if (annotated) {
            if (!signatureMatches) {
                throw new IllegalStateException("@EventSourcingHandler " + method.getDeclaringClass().getName() + "." +
                        method.getName() + " must have the signature (DomainEvent, " + stateClass.getSimpleName() + ")");
            }
            // fail fast on an invalid return type
            EventSourcingHandlerFunctionAdapter.resolveReturnKind(method, stateClass);
            return true;
        }
        if (signatureMatches) {
            String typeName = parameterTypes[0].getAnnotation(DomainEventInfo.class).type();
            if (method.getName().equals(conventionalMethodName(typeName))) {
                EventSourcingHandlerFunctionAdapter.resolveReturnKind(method, stateClass);
                return true;
            }
        }
        return false;
    }

    static boolean isHook(Method method, String hookName, Class<?> stateClass) {
        if (!method.getName().equals(hookName)
                || Modifier.isStatic(method.getModifiers()) || method.isBridge() || method.isSynthetic()) {
            return false;
        }
        Class<?>[] parameterTypes = method.getParameterTypes();
        boolean signatureMatches = parameterTypes.length == 2
                && parameterTypes[0].isAssignableFrom(DomainEvent.class)
                && parameterTypes[1].isAssignableFrom(stateClass)
                && (method.getReturnType() == void.class || CompletionStage.class.isAssignableFrom(method.getReturnType()));
        if (!signatureMatches) {
            throw new IllegalStateException("Hook " + method.getDeclaringClass().getName() + "." + hookName +
                    " must have the signature (DomainEvent, " + stateClass.getSimpleName() + ") and return void or a CompletionStage");
        }
        logger.debug("Registering {}.{} as {} hook", method.getDeclaringClass().getSimpleName(), hookName, hookName);
        return true;
    }

    /**
     * {@code Increment} maps to {@code onIncrement}, a namespaced type such as {@code counter.increment}
     * maps to the last segment.
     */
    static String conventionalMethodName(String typeName) {
        String simpleName = typeName.substring(typeName.lastIndexOf('.') + 1);
        if (simpleName.isEmpty()) {
            return "on";
        }
        return "on" + Character.toUpperCase(simpleName.charAt(0)) + simpleName.substring(1);
    }
}
