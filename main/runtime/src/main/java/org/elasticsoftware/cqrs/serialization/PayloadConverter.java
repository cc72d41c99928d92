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

package org.elasticsoftware.cqrs.serialization;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.Nullable;

/**
 * Brings command and event payloads into the shape a handler was registered with. Payloads that already
 * have the right type are passed through, anything else (a {@code JsonNode} read from storage, a
 * {@code Map}) is converted with Jackson.
 */
public class PayloadConverter {
    private final ObjectMapper objectMapper;

    public PayloadConverter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public @Nullable <T> T convert(String type, @Nullable Object payload, Class<T> targetClass) {
        if (payload == null || targetClass.isInstance(payload)) {
            return targetClass.cast(payload);
        }
        try {
            return objectMapper.convertValue(payload, targetClass);
        } catch (IllegalArgumentException e) {
            throw new PayloadConversionException(type, targetClass, e);
        }
    }
}
