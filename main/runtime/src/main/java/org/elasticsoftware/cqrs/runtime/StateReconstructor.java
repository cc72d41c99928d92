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

package org.elasticsoftware.cqrs.runtime;

import jakarta.annotation.Nullable;
import org.elasticsoftware.cqrs.events.CloudEvent;
import org.elasticsoftware.cqrs.events.UnmatchedEventTypeException;
import org.elasticsoftware.cqrs.registry.HandlerRegistry;
import org.elasticsoftware.cqrs.registry.RegisteredStateRebuilder;
import org.elasticsoftware.cqrs.serialization.PayloadConverter;
import org.elasticsoftware.cqrs.state.StateLoaderFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Rebuilds state by loading the history of a set of subjects and folding it, in the order the loader returned
 * it, through the state rebuilders of a context. Nothing is cached, every call replays the full history.
 */
public class StateReconstructor {
    private static final Logger logger = LoggerFactory.getLogger(StateReconstructor.class);
    private final HandlerRegistry registry;
    private final UpcastResolver upcastResolver;
    private final PayloadConverter payloadConverter;
    private final EngineSettings settings;

    public StateReconstructor(HandlerRegistry registry,
                              UpcastResolver upcastResolver,
                              PayloadConverter payloadConverter,
                              EngineSettings settings) {
        this.registry = registry;
        this.upcastResolver = upcastResolver;
        this.payloadConverter = payloadConverter;
        this.settings = settings;
    }

    public <S> CompletableFuture<S> createState(String context, List<String> subjects) {
        return loadHistory(context, subjects).thenApply(history -> replay(context, history));
    }

    private CompletableFuture<List<CloudEvent<?>>> loadHistory(String context, List<String> subjects) {
        StateLoaderFunction loader = registry.getStateLoader(context);
        if (loader == null) {
            logger.debug("No StateLoader registered for context {}, starting from empty history", context);
            return CompletableFuture.completedFuture(List.of());
        }
        // run the loader inside the chain so a loader that throws fails the future instead of the caller
        return CompletableFuture.completedFuture(subjects)
                .thenCompose(s -> {
                    CompletionStage<List<CloudEvent<?>>> loaded = loader.load(s);
                    return Objects.requireNonNull(loaded, "StateLoader for context " + context + " returned null");
                })
                .thenApply(events -> events == null ? List.<CloudEvent<?>>of() : events);
    }

    private <S> S replay(String context, List<CloudEvent<?>> history) {
        List<CloudEvent<?>> upcasted = history.stream()
                .<CloudEvent<?>>map(event -> upcastResolver.maybeUpcast(context, event))
                .toList();
        S state = null;
        for (CloudEvent<?> event : upcasted) {
            state = fold(context, event, state);
        }
        logger.debug("Replayed {} events in context {}", upcasted.size(), context);
        return state;
    }

    /**
     * Applies a single event to {@code state} through the rebuilder registered for {@code [context|event.type]}.
     * Events without a matching rebuilder leave the state untouched, unless the configured
     * {@link UnmatchedTypePolicy} says otherwise.
     */
    public @Nullable <S> S fold(String context, CloudEvent<?> event, @Nullable S state) {
        RegisteredStateRebuilder<Object, S> rebuilder = registry.getStateRebuilder(context, event.type());
        if (rebuilder != null && rebuilder.context().equals(context)) {
            Object eventData = payloadConverter.convert(event.type(), event.data(), rebuilder.eventClass());
            return rebuilder.rebuilder().apply(eventData, state);
        }
        switch (settings.getUnmatchedEventPolicy()) {
            case FAIL -> throw new UnmatchedEventTypeException(context, event.type());
            case WARN -> logger.warn("No StateRebuilder registered for event type {} in context {}, skipping", event.type(), context);
            case IGNORE -> logger.trace("No StateRebuilder registered for event type {} in context {}, skipping", event.type(), context);
        }
        return state;
    }
}
