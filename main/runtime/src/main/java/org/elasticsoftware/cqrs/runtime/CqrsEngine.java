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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.elasticsoftware.cqrs.commands.Command;
import org.elasticsoftware.cqrs.registry.HandlerRegistry;
import org.elasticsoftware.cqrs.serialization.CloudEventsModule;
import org.elasticsoftware.cqrs.serialization.PayloadConverter;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point of the engine. Wires the {@link StateReconstructor} and {@link CommandDispatcher} around a
 * single {@link HandlerRegistry}; several engines with different registries can live in the same JVM.
 */
public class CqrsEngine {
    private final HandlerRegistry registry;
    private final EngineSettings settings;
    private final StateReconstructor stateReconstructor;
    private final CommandDispatcher commandDispatcher;

    public CqrsEngine(HandlerRegistry registry, EngineSettings settings, ObjectMapper objectMapper) {
        this.registry = registry;
        this.settings = settings;
        PayloadConverter payloadConverter = new PayloadConverter(objectMapper);
        this.stateReconstructor = new StateReconstructor(registry, new UpcastResolver(registry), payloadConverter, settings);
        this.commandDispatcher = new CommandDispatcher(
                registry,
                stateReconstructor,
                new EventMaterializer(settings),
                payloadConverter,
                settings);
    }

    public CqrsEngine(HandlerRegistry registry, EngineSettings settings) {
        this(registry, settings, new ObjectMapper().registerModule(new CloudEventsModule()));
    }

    public CqrsEngine(HandlerRegistry registry) {
        this(registry, EngineSettings.defaults());
    }

    /**
     * Completes with the state after the command has been executed and all event handlers have run, or with
     * {@code null} when no handler is registered for the command type.
     */
    public <S> CompletableFuture<S> handleCommand(Command<?> command) {
        return commandDispatcher.handleCommand(command);
    }

    /**
     * Completes with the state of {@code subjects} in {@code context}, {@code null} when there is no history.
     */
    public <S> CompletableFuture<S> createState(String context, List<String> subjects) {
        return stateReconstructor.createState(context, subjects);
    }

    /**
     * Sets the source used for events that don't carry one.
     */
    public void setSource(String source) {
        settings.setSource(source);
    }

    public String getSource() {
        return settings.getSource();
    }

    public HandlerRegistry getRegistry() {
        return registry;
    }
}
