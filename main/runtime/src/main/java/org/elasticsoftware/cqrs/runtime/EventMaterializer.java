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

import org.elasticsoftware.cqrs.events.CloudEvent;

/**
 * Turns the minimal events returned by command handlers into complete CloudEvents.
 */
public class EventMaterializer {
    private final EngineSettings settings;

    public EventMaterializer(EngineSettings settings) {
        this.settings = settings;
    }

    public <T> CloudEvent<T> materialize(CloudEvent<T> event) {
        return new CloudEvent<>(
                event.id() != null ? event.id() : settings.nextId(),
                event.source() != null ? event.source() : settings.getSource(),
                event.type(),
                event.subject(),
                event.time() != null ? event.time() : settings.getClock().instant(),
                CloudEvent.SPEC_VERSION,
                event.data(),
                event.extensions());
    }
}
