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

package org.elasticsoftware.cqrs.registry;

import org.elasticsoftware.cqrs.commands.CommandHandlerFunction;
import org.elasticsoftware.cqrs.events.AsyncEventHandlerFunction;
import org.elasticsoftware.cqrs.events.EventHandlerFunction;
import org.elasticsoftware.cqrs.events.StateRebuilderFunction;
import org.elasticsoftware.cqrs.events.UpcastingHandlerFunction;
import org.elasticsoftware.cqrs.state.StateLoaderFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static org.elasticsoftware.cqrs.registry.HandlerKind.*;

/**
 * Collects handler registrations during startup. Command handlers are unique per command type across all
 * contexts, state rebuilders and upcasters are unique per {@link RegistrationKey}. Event handlers accumulate
 * in registration order and the last registered state loader for a context wins.
 */
public final class HandlerRegistryBuilder {
    private static final Logger logger = LoggerFactory.getLogger(HandlerRegistryBuilder.class);
    private final Map<String, RegisteredCommandHandler<?, ?>> commandHandlers = new LinkedHashMap<>();
    private final Map<RegistrationKey, RegisteredStateRebuilder<?, ?>> stateRebuilders = new LinkedHashMap<>();
    private final Map<RegistrationKey, UpcastingHandlerFunction> upcasters = new LinkedHashMap<>();
    private final Map<String, List<RegisteredEventHandler<?>>> eventHandlers = new LinkedHashMap<>();
    private final Map<String, StateLoaderFunction> stateLoaders = new LinkedHashMap<>();
    private boolean built = false;

    HandlerRegistryBuilder() {
    }

    public <C, S> HandlerRegistryBuilder registerCommandHandler(String type,
                                                                String context,
                                                                Class<C> commandClass,
                                                                CommandHandlerFunction<C, S> handler) {
        checkNotBuilt();
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(context, "context is required");
        Objects.requireNonNull(commandClass, "commandClass is required");
        Objects.requireNonNull(handler, "handler is required");
        if (commandHandlers.containsKey(type)) {
            throw new DuplicateHandlerRegistrationException(COMMAND_HANDLER, context, type, type);
        }
        commandHandlers.put(type, new RegisteredCommandHandler<>(type, context, commandClass, handler));
        logger.debug("Registered CommandHandler for {} in context {}", type, context);
        return this;
    }

    public <E, S> HandlerRegistryBuilder registerStateRebuilder(String type,
                                                                String context,
                                                                Class<E> eventClass,
                                                                StateRebuilderFunction<E, S> rebuilder) {
        checkNotBuilt();
        Objects.requireNonNull(eventClass, "eventClass is required");
        Objects.requireNonNull(rebuilder, "rebuilder is required");
        RegistrationKey key = new RegistrationKey(context, type);
        if (stateRebuilders.containsKey(key)) {
            throw new DuplicateHandlerRegistrationException(STATE_REBUILDER, context, type, key.asString());
        }
        stateRebuilders.put(key, new RegisteredStateRebuilder<>(key, eventClass, rebuilder));
        logger.debug("Registered StateRebuilder for {}", key);
        return this;
    }

    public HandlerRegistryBuilder registerUpcaster(String type,
                                                   String context,
                                                   UpcastingHandlerFunction upcaster) {
        checkNotBuilt();
        Objects.requireNonNull(upcaster, "upcaster is required");
        RegistrationKey key = new RegistrationKey(context, type);
        if (upcasters.containsKey(key)) {
            throw new DuplicateHandlerRegistrationException(UPCASTER, context, type, key.asString());
        }
        upcasters.put(key, upcaster);
        logger.debug("Registered Upcaster for {}", key);
        return this;
    }

    public HandlerRegistryBuilder registerEventHandler(String type, EventHandlerFunction<Object> handler) {
        return registerEventHandler(type, Object.class, handler);
    }

    public <T> HandlerRegistryBuilder registerEventHandler(String type,
                                                           Class<T> dataClass,
                                                           EventHandlerFunction<T> handler) {
        Objects.requireNonNull(handler, "handler is required");
        return registerAsyncEventHandler(type, dataClass, handler.toAsync());
    }

    public <T> HandlerRegistryBuilder registerAsyncEventHandler(String type,
                                                                Class<T> dataClass,
                                                                AsyncEventHandlerFunction<T> handler) {
        checkNotBuilt();
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(dataClass, "dataClass is required");
        Objects.requireNonNull(handler, "handler is required");
        eventHandlers.computeIfAbsent(type, k -> new ArrayList<>())
                .add(new RegisteredEventHandler<>(type, dataClass, handler));
        logger.debug("Registered EventHandler #{} for {}", eventHandlers.get(type).size(), type);
        return this;
    }

    public HandlerRegistryBuilder registerStateLoader(String context, StateLoaderFunction loader) {
        checkNotBuilt();
        Objects.requireNonNull(context, "context is required");
        Objects.requireNonNull(loader, "loader is required");
        if (stateLoaders.put(context, loader) != null) {
            logger.debug("Replaced StateLoader for context {}", context);
        }
        return this;
    }

    public HandlerRegistry build() {
        checkNotBuilt();
        built = true;
        HandlerRegistry registry = new HandlerRegistry(commandHandlers, stateRebuilders, upcasters, eventHandlers, stateLoaders);
        logger.info("Built {}", registry);
        return registry;
    }

    private void checkNotBuilt() {
        if (built) {
            throw new IllegalStateException("HandlerRegistry has already been built");
        }
    }
}
