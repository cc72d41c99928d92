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
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class EventMaterializerTests {
    private static final Instant NOW = Instant.parse("2024-03-01T10:15:30Z");
    private final EngineSettings settings = new EngineSettings(EngineSettings.DEFAULT_SOURCE,
            UnmatchedTypePolicy.IGNORE, UnmatchedTypePolicy.IGNORE, Clock.fixed(NOW, ZoneOffset.UTC), () -> "generated");
    private final EventMaterializer materializer = new EventMaterializer(settings);

    @Test
    public void testMissingAttributesAreFilledIn() {
        CloudEvent<String> event = materializer.materialize(CloudEvent.of("Borrowed", "/books/1", "alice"));
        assertEquals("generated", event.id());
        assertEquals("CQRS_DEFAULTSOURCE", event.source());
        assertEquals(NOW, event.time());
        assertEquals("1.0", event.specversion());
        assertEquals("Borrowed", event.type());
        assertEquals("/books/1", event.subject());
        assertEquals("alice", event.data());
    }

    @Test
    public void testPresentAttributesArePreserved() {
        Instant then = Instant.parse("2020-01-01T00:00:00Z");
        CloudEvent<String> event = materializer.materialize(CloudEvent.of("Borrowed", "/books/1", "alice")
                .withId("given")
                .withSource("branch-7")
                .withTime(then)
                .withExtension("traceparent", "00-abc-def-01"));
        assertEquals("given", event.id());
        assertEquals("branch-7", event.source());
        assertEquals(then, event.time());
        assertEquals(Map.of("traceparent", "00-abc-def-01"), event.extensions());
    }

    @Test
    public void testSourceChangeAppliesToLaterEvents() {
        CloudEvent<String> before = materializer.materialize(CloudEvent.of("Borrowed", "/books/1", null));
        settings.setSource("library-service");
        CloudEvent<String> after = materializer.materialize(CloudEvent.of("Borrowed", "/books/1", null));
        assertEquals("CQRS_DEFAULTSOURCE", before.source());
        assertEquals("library-service", after.source());
    }

    @Test
    public void testDefaultSettings() {
        EngineSettings defaults = EngineSettings.defaults();
        assertEquals("CQRS_DEFAULTSOURCE", defaults.getSource());
        assertEquals(UnmatchedTypePolicy.IGNORE, defaults.getUnknownCommandPolicy());
        assertEquals(UnmatchedTypePolicy.IGNORE, defaults.getUnmatchedEventPolicy());
        assertNotEquals(defaults.nextId(), defaults.nextId());
        assertThrows(NullPointerException.class, () -> defaults.setSource(null));
    }
}
