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

package org.elasticsoftware.cqrs.beans;

import org.elasticsoftware.cqrs.annotations.*;
import org.elasticsoftware.cqrs.events.CloudEvent;
import org.elasticsoftware.cqrs.registry.HandlerKind;
import org.elasticsoftware.cqrs.registry.HandlerRegistryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.util.ClassUtils;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletionStage;
import java.util.stream.Stream;

/**
 * Registers the annotated handler methods of {@link DomainContext} beans with a {@link HandlerRegistryBuilder}.
 * Methods are processed in name order so registration order, and with it the invocation order of event
 * handlers within one bean, is stable between runs.
 */
public class DomainContextBeanScanner {
    private static final Logger logger = LoggerFactory.getLogger(DomainContextBeanScanner.class);

    public void scan(String beanName, Object bean, HandlerRegistryBuilder builder) {
        Class<?> beanClass = ClassUtils.getUserClass(bean);
        DomainContext domainContext = AnnotationUtils.findAnnotation(beanClass, DomainContext.class);
        if (domainContext == null) {
            throw new IllegalArgumentException("Bean " + beanName + " is not annotated with @DomainContext");
        }
        String context = domainContext.value();
        logger.info("Processing DomainContext bean {} for context {}", beanName, context);
        List<Method> methods = Arrays.stream(beanClass.getMethods())
                .sorted(Comparator.comparing(Method::getName))
                .toList();
        methods.stream()
                .filter(method -> method.isAnnotationPresent(StateLoader.class))
                .forEach(method -> processStateLoader(context, bean, method, builder));
        methods.stream()
                .filter(method -> method.isAnnotationPresent(Upcaster.class))
                .forEach(method -> processUpcaster(context, bean, method, builder));
        methods.stream()
                .filter(method -> method.isAnnotationPresent(StateRebuilder.class))
                .forEach(method -> processStateRebuilder(context, bean, method, builder));
        methods.stream()
                .filter(method -> method.isAnnotationPresent(CommandHandler.class))
                .forEach(method -> processCommandHandler(context, bean, method, builder));
        methods.stream()
                .filter(method -> method.isAnnotationPresent(EventHandler.class))
                .forEach(method -> processEventHandler(context, bean, method, builder));
    }

    private void processCommandHandler(String context, Object bean, Method method, HandlerRegistryBuilder builder) {
        String type = method.getAnnotation(CommandHandler.class).value();
        requireParameterCount(HandlerKind.COMMAND_HANDLER, context, type, method, 2);
        if (!Stream.class.isAssignableFrom(method.getReturnType())) {
            throw new InvalidHandlerException(HandlerKind.COMMAND_HANDLER, context, type, method,
                    "return type must be a Stream of CloudEvents");
        }
        builder.registerCommandHandler(type, context, boxed(method.getParameterTypes()[0]),
                new CommandHandlerFunctionAdapter<>(bean, method));
    }

    private void processStateRebuilder(String context, Object bean, Method method, HandlerRegistryBuilder builder) {
        String type = method.getAnnotation(StateRebuilder.class).value();
        requireParameterCount(HandlerKind.STATE_REBUILDER, context, type, method, 2);
        if (method.getReturnType() == void.class) {
            throw new InvalidHandlerException(HandlerKind.STATE_REBUILDER, context, type, method,
                    "must return the new state");
        }
        builder.registerStateRebuilder(type, context, boxed(method.getParameterTypes()[0]),
                new StateRebuilderFunctionAdapter<>(bean, method));
    }

    private void processUpcaster(String context, Object bean, Method method, HandlerRegistryBuilder builder) {
        String type = method.getAnnotation(Upcaster.class).value();
        requireParameterCount(HandlerKind.UPCASTER, context, type, method, 1);
        if (!CloudEvent.class.equals(method.getParameterTypes()[0]) || !CloudEvent.class.equals(method.getReturnType())) {
            throw new InvalidHandlerException(HandlerKind.UPCASTER, context, type, method,
                    "must accept and return a CloudEvent");
        }
        builder.registerUpcaster(type, context, new UpcastingHandlerFunctionAdapter(bean, method));
    }

    private void processEventHandler(String context, Object bean, Method method, HandlerRegistryBuilder builder) {
        EventHandler eventHandler = method.getAnnotation(EventHandler.class);
        String type = eventHandler.value();
        requireParameterCount(HandlerKind.EVENT_HANDLER, context, type, method, 2);
        if (!CloudEvent.class.equals(method.getParameterTypes()[0])) {
            throw new InvalidHandlerException(HandlerKind.EVENT_HANDLER, context, type, method,
                    "first parameter must be a CloudEvent");
        }
        Class<?> returnType = method.getReturnType();
        if (returnType != void.class && !CompletionStage.class.isAssignableFrom(returnType)) {
            throw new InvalidHandlerException(HandlerKind.EVENT_HANDLER, context, type, method,
                    "return type must be void or a CompletionStage");
        }
        registerEventHandler(type, eventHandler.dataClass(), bean, method, builder);
    }

    private <T> void registerEventHandler(String type, Class<T> dataClass, Object bean, Method method, HandlerRegistryBuilder builder) {
        builder.registerAsyncEventHandler(type, dataClass, new EventHandlerFunctionAdapter<T>(bean, method));
    }

    private void processStateLoader(String context, Object bean, Method method, HandlerRegistryBuilder builder) {
        requireParameterCount(HandlerKind.STATE_LOADER, context, null, method, 1);
        if (!List.class.isAssignableFrom(method.getParameterTypes()[0])
                || !CompletionStage.class.isAssignableFrom(method.getReturnType())) {
            throw new InvalidHandlerException(HandlerKind.STATE_LOADER, context, null, method,
                    "must accept a List of subjects and return a CompletionStage");
        }
        builder.registerStateLoader(context, new StateLoaderFunctionAdapter(bean, method));
    }

    private static void requireParameterCount(HandlerKind kind, String context, String type, Method method, int count) {
        if (method.getParameterCount() != count) {
            throw new InvalidHandlerException(kind, context, type, method,
                    "expected " + count + " parameters but found " + method.getParameterCount());
        }
    }

    @SuppressWarnings("unchecked")
    private static <T> Class<T> boxed(Class<?> type) {
        return (Class<T>) ClassUtils.resolvePrimitiveIfNecessary(type);
    }
}
