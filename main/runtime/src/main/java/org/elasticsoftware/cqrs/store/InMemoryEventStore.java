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

package org.elasticsoftware.cqrs.store;

import org.elasticsoftware.cqrs.events.CloudEvent;
import org.elasticsoftware.cqrs.events.EventHandlerFunction;
import org.elasticsoftware.cqrs.state.StateLoaderFunction;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only event store kept in memory. Registered as a state loader and as an event handler it gives a
 * context a complete, non-durable persistence.
 */
public class InMemoryEventStore {
    private final List<CloudEvent<?>> events = new CopyOnWriteArrayList<>();

    public void append(CloudEvent<?> event) {
        events.add(event);
    }

    /**
     * All events for the given subjects, in append order.
     */
    public CompletionStage<List<CloudEvent<?>>> load(List<String> subjects) {
        Set<String> wanted = new HashSet<>(subjects);
        return CompletableFuture.completedFuture(events.stream()
                .filter(event -> wanted.contains(event.subject()))
                .toList());
    }

    public List<CloudEvent<?>> getEvents() {
        return List.copyOf(events);
    }

    public StateLoaderFunction asStateLoader() {
        return this::load;
    }

    public EventHandlerFunction<Object> asEventHandler() {
        return (event, state) -> append(event);
    }
}
