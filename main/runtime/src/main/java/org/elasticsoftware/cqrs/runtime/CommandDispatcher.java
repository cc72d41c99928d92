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

import org.elasticsoftware.cqrs.commands.Command;
import org.elasticsoftware.cqrs.commands.UnknownCommandTypeException;
import org.elasticsoftware.cqrs.events.CloudEvent;
import org.elasticsoftware.cqrs.registry.HandlerRegistry;
import org.elasticsoftware.cqrs.registry.RegisteredCommandHandler;
import org.elasticsoftware.cqrs.registry.RegisteredEventHandler;
import org.elasticsoftware.cqrs.serialization.PayloadConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Executes a command against state rebuilt from history and propagates the resulting events.
 * <p>
 * The returned future completes with the state after all produced events have been folded in, and only after
 * every event handler has completed. Event handlers run one after the other: per event in the order the
 * command handler produced them, and per event type in registration order. When the command handler throws,
 * no event is materialized and no event handler is invoked; the future completes exceptionally with the
 * handler's exception as its cause.
 */
public class CommandDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(CommandDispatcher.class);
    private final HandlerRegistry registry;
    private final StateReconstructor stateReconstructor;
    private final EventMaterializer eventMaterializer;
    private final PayloadConverter payloadConverter;
    private final EngineSettings settings;

    public CommandDispatcher(HandlerRegistry registry,
                             StateReconstructor stateReconstructor,
                             EventMaterializer eventMaterializer,
                             PayloadConverter payloadConverter,
                             EngineSettings settings) {
        this.registry = registry;
        this.stateReconstructor = stateReconstructor;
        this.eventMaterializer = eventMaterializer;
        this.payloadConverter = payloadConverter;
        this.settings = settings;
    }

    public <S> CompletableFuture<S> handleCommand(Command<?> command) {
        RegisteredCommandHandler<Object, S> commandHandler = registry.getCommandHandler(command.type());
        if (commandHandler == null) {
            return unknownCommand(command);
        }
        String context = commandHandler.context();
        return stateReconstructor.<S>createState(context, command.subjects())
                .thenApply(state -> execute(commandHandler, command, state))
                .thenCompose(outcome -> dispatch(outcome.events(), outcome.state())
                        .thenApply(ignored -> outcome.state()));
    }

    private <S> CompletableFuture<S> unknownCommand(Command<?> command) {
        switch (settings.getUnknownCommandPolicy()) {
            case FAIL -> {
                return CompletableFuture.failedFuture(new UnknownCommandTypeException(command.type()));
            }
            case WARN -> logger.warn("No CommandHandler registered for command type {}, ignoring", command.type());
            case IGNORE -> logger.debug("No CommandHandler registered for command type {}, ignoring", command.type());
        }
        return CompletableFuture.completedFuture(null);
    }

    private <S> Outcome<S> execute(RegisteredCommandHandler<Object, S> commandHandler, Command<?> command, S state) {
        Object commandData = payloadConverter.convert(command.type(), command.data(), commandHandler.commandClass());
        List<CloudEvent<?>> newEvents;
        try (Stream<CloudEvent<?>> produced = commandHandler.handler().apply(commandData, state)) {
            newEvents = Objects.requireNonNull(produced, "CommandHandler for " + command.type() + " returned null").toList();
        }
        // fold first, so every event sees the effect of the ones produced before it
        S nextState = state;
        for (CloudEvent<?> event : newEvents) {
            nextState = stateReconstructor.fold(commandHandler.context(), event, nextState);
        }
        List<CloudEvent<?>> materialized = new ArrayList<>(newEvents.size());
        for (CloudEvent<?> event : newEvents) {
            materialized.add(eventMaterializer.materialize(event));
        }
        logger.debug("Command {} produced {} events", command.type(), materialized.size());
        return new Outcome<>(nextState, materialized);
    }

    private CompletableFuture<Void> dispatch(List<CloudEvent<?>> events, Object state) {
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (CloudEvent<?> event : events) {
            for (RegisteredEventHandler<?> eventHandler : registry.getEventHandlers(event.type())) {
                chain = chain.thenCompose(ignored -> invoke(eventHandler, event, state));
            }
        }
        return chain;
    }

    @SuppressWarnings("unchecked")
    private CompletableFuture<Void> invoke(RegisteredEventHandler<?> eventHandler, CloudEvent<?> event, Object state) {
        RegisteredEventHandler<Object> handler = (RegisteredEventHandler<Object>) eventHandler;
        Object data = payloadConverter.convert(event.type(), event.data(), handler.dataClass());
        CloudEvent<Object> typedEvent = data == event.data() ? (CloudEvent<Object>) event : event.withData(data);
        return Objects.requireNonNull(handler.handler().apply(typedEvent, state),
                "EventHandler for " + event.type() + " returned null").toCompletableFuture();
    }

    private record Outcome<S>(S state, List<CloudEvent<?>> events) {
    }
}
