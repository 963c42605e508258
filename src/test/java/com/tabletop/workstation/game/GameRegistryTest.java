package com.tabletop.workstation.game;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class GameRegistryTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ActionProcessor processor =
            new ActionProcessor(RandomSource.seeded(5), Clock.systemUTC(), 7, Set.of("loyalty"));
    private InMemorySnapshotStore store;
    private ApplicationEventPublisher events;
    private GameRegistry registry;

    @BeforeEach
    void setUp() {
        store = new InMemorySnapshotStore();
        events = mock(ApplicationEventPublisher.class);
        registry = new GameRegistry(processor, mapper, store, events);
    }

    @AfterEach
    void tearDown() {
        registry.shutdown();
    }

    @Test
    void createdGamesGetShortReadableIds() {
        GameSession session = registry.create("casual");

        assertTrue(session.getGameId().matches("[ABCDEFGHJKLMNPQRSTUVWXYZ23456789]{6}"));
        assertSame(session, registry.require(session.getGameId()));
    }

    @Test
    void mutationsArePublishedAsEvents() throws Exception {
        GameSession session = registry.create("casual");

        session.join("Alice", 20).get(5, TimeUnit.SECONDS);

        verify(events).publishEvent(any(SnapshotPublishedEvent.class));
    }

    @Test
    void deleteClosesSessionAndAnnouncesIt() {
        GameSession session = registry.create("casual");

        registry.delete(session.getGameId());

        assertFalse(registry.contains(session.getGameId()));
        verify(events).publishEvent(new GameDeletedEvent(session.getGameId()));
        GameException error = assertThrows(GameException.class, () -> registry.delete(session.getGameId()));
        assertEquals(ErrorKind.NOT_FOUND, error.getKind());
    }

    @Test
    void rehydrateRestoresStoredGamesWithTheirVersion() throws Exception {
        GameSession original = new GameSession(processor.newGame("REHYD1", "stored"), processor, mapper, store::save);
        original.join("Alice", 20).get(5, TimeUnit.SECONDS);
        original.join("Bob", 20).get(5, TimeUnit.SECONDS);
        original.close();

        registry.rehydrate();

        GameSession restored = registry.require("REHYD1");
        assertEquals(2, restored.latest().version());
        assertEquals(2, restored.latest().state().getPlayers().size());
        assertEquals(original.latest().json(), restored.latest().json());
    }

    @Test
    void unavailableStoreStartsEmpty() {
        SnapshotStore broken = mock(SnapshotStore.class);
        when(broken.loadAll()).thenThrow(new IllegalStateException("connection refused"));
        GameRegistry fresh = new GameRegistry(processor, mapper, broken, events);

        fresh.rehydrate();

        assertEquals(List.of(), List.copyOf(fresh.list()));
    }
}
