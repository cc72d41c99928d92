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

import jakarta.annotation.Nullable;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * An immutable fact in CloudEvents 1.0 form. Command handlers produce the minimal form ({@code type},
 * {@code subject} and {@code data}), the engine fills in {@code id}, {@code source}, {@code time} and
 * {@code specversion} before the event is handed to the event handlers.
 *
 * @param id          unique id of the event, generated when absent
 * @param source      the producer of the event, the configured default source when absent
 * @param type        the event type, selects state rebuilders, upcasters and event handlers
 * @param subject     the entity the event belongs to
 * @param time        the moment the event was produced
 * @param specversion the CloudEvents version, always {@value #SPEC_VERSION} once materialized
 * @param data        the event payload
 * @param extensions  extension attributes, carried through verbatim
 * @param <T>         the payload type
 */
public record CloudEvent<T>(@Nullable String id,
                            @Nullable String source,
                            @NotNull String type,
                            @NotNull String subject,
                            @Nullable Instant time,
                            @Nullable String specversion,
                            @Nullable T data,
                            @NotNull Map<String, Object> extensions) {
    public static final String SPEC_VERSION = "1.0";
    /**
     * Attribute names that are not available as extension names.
     */
    public static final Set<String> CONTEXT_ATTRIBUTES =
            Set.of("specversion", "id", "source", "type", "subject", "time", "data");

    public CloudEvent {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(subject, "subject is required");
        extensions = extensions == null || extensions.isEmpty() ? Map.of() : unmodifiableCopy(extensions);
        for (String name : extensions.keySet()) {
            if (CONTEXT_ATTRIBUTES.contains(name)) {
                throw new IllegalArgumentException("Extension name '" + name + "' is reserved for a CloudEvents attribute");
            }
        }
    }

    public static <T> CloudEvent<T> of(String type, String subject, T data) {
        return new CloudEvent<>(null, null, type, subject, null, null, data, Map.of());
    }

    public <R> CloudEvent<R> withData(R newData) {
        return new CloudEvent<>(id, source, type, subject, time, specversion, newData, extensions);
    }

    public CloudEvent<T> withType(String newType) {
        return new CloudEvent<>(id, source, newType, subject, time, specversion, data, extensions);
    }

    public CloudEvent<T> withSource(String newSource) {
        return new CloudEvent<>(id, newSource, type, subject, time, specversion, data, extensions);
    }

    public CloudEvent<T> withId(String newId) {
        return new CloudEvent<>(newId, source, type, subject, time, specversion, data, extensions);
    }

    public CloudEvent<T> withTime(Instant newTime) {
        return new CloudEvent<>(id, source, type, subject, newTime, specversion, data, extensions);
    }

    public CloudEvent<T> withExtension(String name, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(extensions);
        copy.put(name, value);
        return new CloudEvent<>(id, source, type, subject, time, specversion, data, copy);
    }

    private static Map<String, Object> unmodifiableCopy(Map<String, Object> extensions) {
        // keeps insertion order, Map.copyOf would not
        return Collections.unmodifiableMap(new LinkedHashMap<>(extensions));
    }
}
