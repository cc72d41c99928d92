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

package org.elasticsoftware.cqrs.events;

import jakarta.validation.constraints.NotNull;

/**
 * Translates a stored event from an older shape into the current one. Runs on every replay, so it needs to
 * be pure and total.
 */
@FunctionalInterface
public interface UpcastingHandlerFunction {
    @NotNull CloudEvent<?> apply(@NotNull CloudEvent<?> event);
}
