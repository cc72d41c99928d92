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

import jakarta.annotation.Nullable;
import org.elasticsoftware.cqrs.events.UpcastingHandlerFunction;
import org.elasticsoftware.cqrs.state.StateLoaderFunction;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Immutable lookup tables for all handlers of an engine instance. Instances are created through
 * {@link #builder()} during startup and are read-only afterwards, so they can be shared between
 * concurrent dispatches.
 */
public final class HandlerRegistry {
    private final Map<String, RegisteredCommandHandler<?, ?>> commandHandlers;
    private final Map<RegistrationKey, RegisteredStateRebuilder<?, ?>> stateRebuilders;
    private final Map<RegistrationKey, UpcastingHandlerFunction> upcasters;
    private final Map<String, List<RegisteredEventHandler<?>>> eventHandlers;
    private final Map<String, StateLoaderFunction> stateLoaders;

    HandlerRegistry(Map<String, RegisteredCommandHandler<?, ?>> commandHandlers,
                    Map<RegistrationKey, RegisteredStateRebuilder<?, ?>> stateRebuilders,
                    Map<RegistrationKey, UpcastingHandlerFunction> upcasters,
                    Map<String, List<RegisteredEventHandler<?>>> eventHandlers,
                    Map<String, StateLoaderFunction> stateLoaders) {
        this.commandHandlers = Map.copyOf(commandHandlers);
        this.stateRebuilders = Map.copyOf(stateRebuilders);
        this.upcasters = Map.copyOf(upcasters);
        this.eventHandlers = eventHandlers.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, entry -> List.copyOf(entry.getValue())));
        this.stateLoaders = Map.copyOf(stateLoaders);
    }

    public static HandlerRegistryBuilder builder() {
        return new HandlerRegistryBuilder();
    }

    @SuppressWarnings("unchecked")
    public @Nullable <C, S> RegisteredCommandHandler<C, S> getCommandHandler(String type) {
        return (RegisteredCommandHandler<C, S>) commandHandlers.get(type);
    }

    @SuppressWarnings("unchecked")
    public @Nullable <E, S> RegisteredStateRebuilder<E, S> getStateRebuilder(String context, String type) {
        return (RegisteredStateRebuilder<E, S>) stateRebuilders.get(new RegistrationKey(context, type));
    }

    public @Nullable UpcastingHandlerFunction getUpcaster(String context, String type) {
        return upcasters.get(new RegistrationKey(context, type));
    }

    public List<RegisteredEventHandler<?>> getEventHandlers(String type) {
        return eventHandlers.getOrDefault(type, List.of());
    }

    public @Nullable StateLoaderFunction getStateLoader(String context) {
        return stateLoaders.get(context);
    }

    @Override
    public String toString() {
        return "HandlerRegistry{" +
                "commandHandlers=" + commandHandlers.size() +
                ", stateRebuilders=" + stateRebuilders.size() +
                ", upcasters=" + upcasters.size() +
                ", eventHandlers=" + eventHandlers.values().stream().mapToInt(List::size).sum() +
                ", stateLoaders=" + stateLoaders.size() +
                '}';
    }
}
