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

package org.elasticsoftware.cqrs.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.elasticsoftware.cqrs.commands.Command;
import org.elasticsoftware.cqrs.commands.UnknownCommandTypeException;
import org.elasticsoftware.cqrs.events.CloudEvent;
import org.elasticsoftware.cqrs.library.BookState;
import org.elasticsoftware.cqrs.library.BorrowBookCommand;
import org.elasticsoftware.cqrs.library.LibraryDomain;
import org.elasticsoftware.cqrs.library.LoanLedger;
import org.elasticsoftware.cqrs.library.RegisterBookCommand;
import org.elasticsoftware.cqrs.runtime.CqrsEngine;
import org.elasticsoftware.cqrs.runtime.EngineSettings;
import org.elasticsoftware.cqrs.runtime.UnmatchedTypePolicy;
import org.elasticsoftware.cqrs.store.InMemoryEventStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;

import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.stream.Stream;

import static org.elasticsoftware.cqrs.library.LibraryHandlers.subject;
import static org.junit.jupiter.api.Assertions.*;

@SpringJUnitConfig(classes = {CqrsEngineConfiguration.class, CqrsEngineConfigurationTests.LibraryConfiguration.class})
@TestPropertySource(properties = {
        "cqrs.engine.source=library-service",
        "cqrs.engine.unknown-command-policy=FAIL"
})
@DirtiesContext
public class CqrsEngineConfigurationTests {
    @Autowired
    private CqrsEngine engine;
    @Autowired
    private InMemoryEventStore eventStore;
    @Autowired
    private LoanLedger loanLedger;
    @Autowired
    @Qualifier("cqrsEngineSettings")
    private EngineSettings settings;
    @Autowired
    @Qualifier("cqrsEngineObjectMapper")
    private ObjectMapper objectMapper;

    @Test
    public void testPropertiesAreApplied() {
        assertEquals("library-service", settings.getSource());
        assertEquals(UnmatchedTypePolicy.FAIL, settings.getUnknownCommandPolicy());
        // not overridden, taken from cqrs-engine.properties
        assertEquals(UnmatchedTypePolicy.IGNORE, settings.getUnmatchedEventPolicy());
    }

    @Test
    public void testDomainContextBeansAndCustomizersAreRegistered() {
        assertNotNull(engine.getRegistry().getCommandHandler("register"));
        assertNotNull(engine.getRegistry().getCommandHandler("catalog"));
        assertEquals(2, engine.getRegistry().getEventHandlers("Borrowed").size());
    }

    @Test
    public void testCommandsRunAgainstConfiguredEngine() {
        engine.handleCommand(Command.of("register", new RegisterBookCommand("42", 2), subject("42"))).join();
        BookState state = engine.<BookState>handleCommand(
                Command.of("borrow", new BorrowBookCommand("42", "alice"), subject("42"))).join();
        assertEquals(new BookState("42", 1), state);
        assertTrue(loanLedger.getBorrowers().contains("alice"));
        List<CloudEvent<?>> stored = eventStore.load(List.of(subject("42"))).toCompletableFuture().join();
        assertEquals(2, stored.size());
        stored.forEach(event -> assertEquals("library-service", event.source()));
    }

    @Test
    public void testUnknownCommandFails() {
        CompletionException exception = assertThrows(CompletionException.class,
                () -> engine.handleCommand(Command.of("reserve", null, subject("42"))).join());
        assertInstanceOf(UnknownCommandTypeException.class, exception.getCause());
    }

    @Test
    public void testObjectMapperWritesCloudEvents() throws Exception {
        String json = objectMapper.writeValueAsString(CloudEvent.of("Borrowed", subject("42"), null));
        assertEquals("{\"specversion\":\"1.0\",\"type\":\"Borrowed\",\"subject\":\"/books/42\"}", json);
    }

    @Configuration
    public static class LibraryConfiguration {
        @Bean
        public InMemoryEventStore eventStore() {
            return new InMemoryEventStore();
        }

        @Bean
        public LibraryDomain libraryDomain(InMemoryEventStore eventStore) {
            return new LibraryDomain(eventStore);
        }

        @Bean
        public LoanLedger loanLedger() {
            return new LoanLedger();
        }

        @Bean
        public HandlerRegistryCustomizer catalogCustomizer() {
            return builder -> builder.registerCommandHandler("catalog", "catalog", Object.class,
                    (Object command, Object state) -> Stream.empty());
        }
    }
}
