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
import org.elasticsoftware.cqrs.registry.HandlerRegistry;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class UpcastResolverTests {
    private final UpcastResolver upcastResolver = new UpcastResolver(HandlerRegistry.builder()
            .registerUpcaster("Registered", "library",
                    event -> event.withType("RegisteredV2").withData(Map.of("amount", 1)))
            .registerUpcaster("Lost", "library", event -> null)
            .build());

    @Test
    public void testEventWithoutUpcasterIsReturnedAsIs() {
        CloudEvent<String> event = CloudEvent.of("Borrowed", "/books/1", "alice");
        assertSame(event, upcastResolver.maybeUpcast("library", event));
    }

    @Test
    public void testUpcasterOutputReplacesEvent() {
        CloudEvent<String> event = CloudEvent.of("Registered", "/books/1", "legacy");
        CloudEvent<?> upcasted = upcastResolver.maybeUpcast("library", event);
        assertEquals("RegisteredV2", upcasted.type());
        assertEquals(Map.of("amount", 1), upcasted.data());
        assertEquals("/books/1", upcasted.subject());
        // the original is untouched
        assertEquals("Registered", event.type());
        assertEquals("legacy", event.data());
    }

    @Test
    public void testUpcastersAreScopedByContext() {
        CloudEvent<String> event = CloudEvent.of("Registered", "/books/1", "legacy");
        assertSame(event, upcastResolver.maybeUpcast("warehouse", event));
    }

    @Test
    public void testUpcasterReturningNullFails() {
        CloudEvent<String> event = CloudEvent.of("Lost", "/books/1", null);
        IllegalStateException exception = assertThrows(IllegalStateException.class,
                () -> upcastResolver.maybeUpcast("library", event));
        assertEquals("Upcaster for [library|Lost] returned null", exception.getMessage());
    }
}
