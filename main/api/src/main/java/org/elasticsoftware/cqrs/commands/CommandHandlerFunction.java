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

package org.elasticsoftware.cqrs.commands;

import jakarta.annotation.Nullable;
import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.cqrs.events.CloudEvent;

import java.util.stream.Stream;

/**
 * Business logic for a single command type. Implementations validate the command against the current state
 * and either return the resulting events or throw to abort the dispatch.
 *
 * @param <C> the command payload type
 * @param <S> the state type of the context the handler is registered in
 */
@FunctionalInterface
public interface CommandHandlerFunction<C, S> {
    @NotNull Stream<CloudEvent<?>> apply(C command, @Nullable S state);
}
