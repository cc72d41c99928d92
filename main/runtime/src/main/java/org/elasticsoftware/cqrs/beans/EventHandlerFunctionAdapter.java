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

import org.elasticsoftware.cqrs.events.AsyncEventHandlerFunction;
import org.elasticsoftware.cqrs.events.CloudEvent;

import java.lang.reflect.Method;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Adapts both {@code void} and {@code CompletionStage} returning event handler methods.
 */
public class EventHandlerFunctionAdapter<T> extends HandlerMethodAdapter implements AsyncEventHandlerFunction<T> {
    private final boolean async;

    public EventHandlerFunctionAdapter(Object bean, Method method) {
        super(bean, method);
        this.async = CompletionStage.class.isAssignableFrom(method.getReturnType());
    }

    @Override
    @SuppressWarnings("unchecked")
    public CompletionStage<Void> apply(CloudEvent<T> event, Object state) {
        Object result = invoke(event, state);
        if (async) {
            return (CompletionStage<Void>) result;
        }
        return CompletableFuture.completedFuture(null);
    }
}
