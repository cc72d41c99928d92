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

import com.fasterxml.jackson.databind.JsonNode;
import org.elasticsoftware.cqrs.commands.Command;
import org.elasticsoftware.cqrs.commands.UnknownCommandTypeException;
import org.elasticsoftware.cqrs.events.CloudEvent;
import org.elasticsoftware.cqrs.events.EventHandlerFunction;
import org.elasticsoftware.cqrs.library.BookBorrowedEvent;
import org.elasticsoftware.cqrs.library.BookNotAvailableException;
import org.elasticsoftware.cqrs.library.BookRegisteredEvent;
import org.elasticsoftware.cqrs.library.BookState;
import org.elasticsoftware.cqrs.library.BorrowBookCommand;
import org.elasticsoftware.cqrs.library.LibraryHandlers;
import org.elasticsoftware.cqrs.registry.HandlerRegistry;
import org.elasticsoftware.cqrs.registry.HandlerRegistryBuilder;
import org.elasticsoftware.cqrs.store.InMemoryEventStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static org.elasticsoftware.cqrs.library.LibraryHandlers.subject;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class CommandDispatcherTests {
    private static final Instant NOW = Instant.parse("2024-03-01T10:15:30Z");
    private InMemoryEventStore eventStore;

    @BeforeEach
    public void setUp() {
        eventStore = new InMemoryEventStore();
        eventStore.append(CloudEvent.of("Registered", subject("1"), new BookRegisteredEvent("1", 3)));
    }

    private static EngineSettings settings(UnmatchedTypePolicy unknownCommandPolicy) {
        AtomicInteger ids = new AtomicInteger();
        return new EngineSettings("library-service", unknownCommandPolicy, UnmatchedTypePolicy.IGNORE,
                Clock.fixed(NOW, ZoneOffset.UTC), () -> "event-" + ids.incrementAndGet());
    }

    private CqrsEngine engine(HandlerRegistryBuilder builder) {
        return new CqrsEngine(builder.build(), settings(UnmatchedTypePolicy.IGNORE));
    }

    private static Command<BorrowBookCommand> borrow(String borrower) {
        return Command.of("borrow", new BorrowBookCommand("1", borrower), subject("1"));
    }

    @Test
    public void testUnknownCommandIsIgnored() {
        CqrsEngine engine = engine(LibraryHandlers.register(HandlerRegistry.builder(), eventStore));
        assertNull(engine.handleCommand(Command.of("reserve", null, subject("1"))).join());
        assertEquals(1, eventStore.getEvents().size());
    }

    @Test
    public void testUnknownCommandFailsWithFailPolicy() {
        CqrsEngine engine = new CqrsEngine(
                LibraryHandlers.register(HandlerRegistry.builder(), eventStore).build(),
                settings(UnmatchedTypePolicy.FAIL));
        CompletionException exception = assertThrows(CompletionException.class,
                () -> engine.handleCommand(Command.of("reserve", null, subject("1"))).join());
        UnknownCommandTypeException cause = assertInstanceOf(UnknownCommandTypeException.class, exception.getCause());
        assertEquals("reserve", cause.getType());
    }

    @Test
    public void testResultingStateIncludesProducedEvents() {
        CqrsEngine engine = engine(LibraryHandlers.register(HandlerRegistry.builder(), eventStore));
        BookState state = engine.<BookState>handleCommand(borrow("alice")).join();
        assertEquals(new BookState("1", 2), state);
        assertEquals(state, engine.createState(LibraryHandlers.CONTEXT, List.of(subject("1"))).join());
    }

    @Test
    public void testEachProducedEventSeesThePreviousOnes() {
        List<Integer> observed = new ArrayList<>();
        HandlerRegistryBuilder builder = HandlerRegistry.builder()
                .registerStateLoader("library", eventStore.asStateLoader())
                .registerStateRebuilder("Registered", "library", BookRegisteredEvent.class,
                        (BookRegisteredEvent event, BookState state) -> new BookState(event.id(), event.amount()))
                .registerStateRebuilder("Borrowed", "library", BookBorrowedEvent.class,
                        (BookBorrowedEvent event, BookState state) -> {
                            observed.add(state.amount());
                            return new BookState(state.id(), state.amount() - 1);
                        })
                .registerCommandHandler("borrowAll", "library", Object.class,
                        (Object command, BookState state) -> Stream.of(
                                CloudEvent.of("Borrowed", subject("1"), new BookBorrowedEvent("alice")),
                                CloudEvent.of("Borrowed", subject("1"), new BookBorrowedEvent("bob")),
                                CloudEvent.of("Borrowed", subject("1"), new BookBorrowedEvent("carol"))));
        BookState state = engine(builder).<BookState>handleCommand(Command.of("borrowAll", null, subject("1"))).join();
        assertEquals(new BookState("1", 0), state);
        assertEquals(List.of(3, 2, 1), observed);
    }

    @Test
    public void testProducedEventsAreMaterialized() {
        List<CloudEvent<?>> received = new ArrayList<>();
        HandlerRegistryBuilder builder = LibraryHandlers.register(HandlerRegistry.builder(), eventStore)
                .registerEventHandler("Borrowed", (event, state) -> received.add(event));
        engine(builder).handleCommand(borrow("alice")).join();

        assertEquals(1, received.size());
        CloudEvent<?> event = received.get(0);
        assertEquals("event-1", event.id());
        assertEquals("library-service", event.source());
        assertEquals("Borrowed", event.type());
        assertEquals(subject("1"), event.subject());
        assertEquals(NOW, event.time());
        assertEquals(CloudEvent.SPEC_VERSION, event.specversion());
        assertEquals(new BookBorrowedEvent("alice"), event.data());
    }

    @Test
    public void testEventHandlersRunPerEventInRegistrationOrder() {
        @SuppressWarnings("unchecked")
        EventHandlerFunction<Object> audit = mock(EventHandlerFunction.class);
        @SuppressWarnings("unchecked")
        EventHandlerFunction<Object> notifier = mock(EventHandlerFunction.class);
        HandlerRegistryBuilder builder = HandlerRegistry.builder()
                .registerStateLoader("library", eventStore.asStateLoader())
                .registerCommandHandler("checkout", "library", Object.class,
                        (Object command, Object state) -> Stream.of(
                                CloudEvent.of("Borrowed", subject("1"), "first"),
                                CloudEvent.of("Borrowed", subject("1"), "second")))
                .registerEventHandler("Borrowed", audit::apply)
                .registerEventHandler("Borrowed", notifier::apply);
        engine(builder).handleCommand(Command.of("checkout", null, subject("1"))).join();

        InOrder inOrder = inOrder(audit, notifier);
        inOrder.verify(audit).apply(argThat(event -> "first".equals(event.data())), any());
        inOrder.verify(notifier).apply(argThat(event -> "first".equals(event.data())), any());
        inOrder.verify(audit).apply(argThat(event -> "second".equals(event.data())), any());
        inOrder.verify(notifier).apply(argThat(event -> "second".equals(event.data())), any());
        inOrder.verifyNoMoreInteractions();
    }

    @Test
    public void testEventHandlersReceiveFinalState() {
        List<Object> states = new ArrayList<>();
        HandlerRegistryBuilder builder = LibraryHandlers.register(HandlerRegistry.builder(), eventStore)
                .registerEventHandler("Borrowed", (event, state) -> states.add(state));
        engine(builder).handleCommand(borrow("alice")).join();
        assertEquals(List.of(new BookState("1", 2)), states);
    }

    @Test
    public void testRejectedCommandHasNoSideEffects() {
        @SuppressWarnings("unchecked")
        EventHandlerFunction<Object> audit = mock(EventHandlerFunction.class);
        InMemoryEventStore emptyStore = new InMemoryEventStore();
        HandlerRegistryBuilder builder = LibraryHandlers.register(HandlerRegistry.builder(), emptyStore)
                .registerEventHandler("Borrowed", audit::apply);
        CompletionException exception = assertThrows(CompletionException.class,
                () -> engine(builder).handleCommand(borrow("alice")).join());
        assertInstanceOf(BookNotAvailableException.class, exception.getCause());
        verifyNoInteractions(audit);
        assertTrue(emptyStore.getEvents().isEmpty());
    }

    @Test
    public void testAsyncEventHandlersAreAwaitedOneAfterTheOther() {
        CompletableFuture<Void> slowProjection = new CompletableFuture<>();
        List<String> calls = new ArrayList<>();
        HandlerRegistryBuilder builder = LibraryHandlers.register(HandlerRegistry.builder(), eventStore)
                .registerAsyncEventHandler("Borrowed", Object.class, (event, state) -> {
                    calls.add("projection");
                    return slowProjection;
                })
                .registerEventHandler("Borrowed", (event, state) -> calls.add("mailer"));

        CompletableFuture<BookState> result = engine(builder).handleCommand(borrow("alice"));
        assertFalse(result.isDone());
        assertEquals(List.of("projection"), calls);

        slowProjection.complete(null);
        assertEquals(new BookState("1", 2), result.join());
        assertEquals(List.of("projection", "mailer"), calls);
    }

    @Test
    public void testFailingEventHandlerFailsTheCommand() {
        @SuppressWarnings("unchecked")
        EventHandlerFunction<Object> mailer = mock(EventHandlerFunction.class);
        IllegalStateException failure = new IllegalStateException("projection down");
        HandlerRegistryBuilder builder = LibraryHandlers.register(HandlerRegistry.builder(), eventStore)
                .registerAsyncEventHandler("Borrowed", Object.class,
                        (event, state) -> CompletableFuture.failedFuture(failure))
                .registerEventHandler("Borrowed", mailer::apply);
        CompletionException exception = assertThrows(CompletionException.class,
                () -> engine(builder).handleCommand(borrow("alice")).join());
        assertSame(failure, exception.getCause());
        verifyNoInteractions(mailer);
    }

    @Test
    public void testPayloadsAreConvertedToRegisteredTypes() {
        List<JsonNode> payloads = new ArrayList<>();
        HandlerRegistryBuilder builder = LibraryHandlers.register(HandlerRegistry.builder(), eventStore)
                .registerEventHandler("Borrowed", JsonNode.class, (event, state) -> payloads.add(event.data()));
        // command data arrives as a map, the handler was registered with BorrowBookCommand
        BookState state = engine(builder).<BookState>handleCommand(
                Command.of("borrow", Map.of("id", "1", "borrower", "alice"), subject("1"))).join();
        assertEquals(new BookState("1", 2), state);
        assertEquals(1, payloads.size());
        assertEquals("alice", payloads.get(0).get("borrower").asText());
    }

    @Test
    public void testProducedEventsAreNotUpcast() {
        HandlerRegistryBuilder builder = LibraryHandlers.register(HandlerRegistry.builder(), eventStore)
                .registerUpcaster("Borrowed", "library", event -> event.withType("Misplaced"));
        CqrsEngine engine = engine(builder);
        assertEquals(new BookState("1", 2), engine.handleCommand(borrow("alice")).join());
        // on replay the stored Borrowed event is upcast to a type without a rebuilder
        assertEquals(new BookState("1", 3), engine.createState("library", List.of(subject("1"))).join());
    }
}
