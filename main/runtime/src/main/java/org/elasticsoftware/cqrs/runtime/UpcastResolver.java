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
import org.elasticsoftware.cqrs.events.UpcastingHandlerFunction;
import org.elasticsoftware.cqrs.registry.HandlerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class UpcastResolver {
    private static final Logger logger = LoggerFactory.getLogger(UpcastResolver.class);
    private final HandlerRegistry registry;

    public UpcastResolver(HandlerRegistry registry) {
        this.registry = registry;
    }

    /**
     * Replaces the event with the output of the upcaster registered for {@code [context|event.type]}, or
     * returns the event itself when there is none. The stored event is never modified.
     */
    public CloudEvent<?> maybeUpcast(String context, CloudEvent<?> event) {
        UpcastingHandlerFunction upcaster = registry.getUpcaster(context, event.type());
        if (upcaster == null) {
            return event;
        }
        CloudEvent<?> upcasted = upcaster.apply(event);
        if (upcasted == null) {
            throw new IllegalStateException("Upcaster for [" + context + "|" + event.type() + "] returned null");
        }
        logger.trace("Upcasted {} to {} in context {}", event.type(), upcasted.type(), context);
        return upcasted;
    }
}
