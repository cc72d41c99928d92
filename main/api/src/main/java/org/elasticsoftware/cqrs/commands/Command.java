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

import java.util.List;
import java.util.Objects;

/**
 * An intent to change state. The {@code type} selects the command handler, the {@code subjects} are used
 * to load the history the handler decides on.
 *
 * @param type     the unique command type
 * @param subjects the subjects to fetch state from
 * @param data     the handler specific payload
 * @param <C>      the type of the payload
 */
public record Command<C>(@NotNull String type, @NotNull List<String> subjects, @Nullable C data) {
    public Command {
        Objects.requireNonNull(type, "type is required");
        subjects = subjects == null ? List.of() : List.copyOf(subjects);
    }

    public static <C> Command<C> of(String type, C data, String... subjects) {
        return new Command<>(type, List.of(subjects), data);
    }
}
