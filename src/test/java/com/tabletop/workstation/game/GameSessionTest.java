package com.tabletop.workstation.game;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class GameSessionTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final List<GameSnapshot> published = new CopyOnWriteArrayList<>();
    private ActionProcessor processor;
    private GameSession session;
    private String alice;
    private String bob;

    @BeforeEach
    void setUp() throws Exception {
        processor = new ActionProcessor(RandomSource.seeded(7), Clock.systemUTC(), 7, Set.of("loyalty"));
        session = new GameSession(processor.newGame("GAME01", "session test"), processor, mapper, published::add);
        alice = session.join("Alice", 20).get(5, TimeUnit.SECONDS).playerId();
        bob = session.join("Bob", 20).get(5, TimeUnit.SECONDS).playerId();
    }

    @AfterEach
    void tearDown() {
        session.close();
    }

    @Test
    void joinsBumpVersionAndPublish() {
        assertEquals(2, session.latest().version());
        assertEquals(List.of(1L, 2L), published.stream().map(GameSnapshot::version).toList());
    }

    @Test
    void thirdJoinFailsWithCapacityExceeded() {
        ExecutionException error = assertThrows(ExecutionException.class,
                () -> session.join("Carol", 20).get(5, TimeUnit.SECONDS));

        assertInstanceOf(GameException.class, error.getCause());
        assertEquals(ErrorKind.CAPACITY_EXCEEDED, ((GameException) error.getCause()).getKind());
        assertEquals(2, session.latest().version());
    }

    @Test
    void concurrentMoveAndTapAreBothApplied() throws Exception {
        String cardId = drawOneCard();
        long before = session.latest().version();

        ExecutorService clients = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            CompletableFuture<ActionReport> move = CompletableFuture.supplyAsync(() -> {
                await(start);
                return session.submit(GameAction.of(alice, ActionType.MOVE_CARD,
                        mapper.createObjectNode().put("cardId", cardId).put("toZone", "battlefield").put("x", 10).put("y", 20)));
            }, clients).thenCompose(future -> future);
            CompletableFuture<ActionReport> tap = CompletableFuture.supplyAsync(() -> {
                await(start);
                return session.submit(GameAction.of(bob, ActionType.TAP_CARD,
                        mapper.createObjectNode().put("cardId", cardId)));
            }, clients).thenCompose(future -> future);

            start.countDown();
            move.get(5, TimeUnit.SECONDS);
            tap.get(5, TimeUnit.SECONDS);
        } finally {
            clients.shutdownNow();
        }

        GameState finalState = session.latest().state();
        CardLocation location = finalState.requireCard(cardId);
        assertEquals(ZoneType.BATTLEFIELD, location.zone().getZoneType());
        assertTrue(location.card().isTapped());
        assertEquals(10, location.card().getData().getX());
        assertEquals(before + 2, session.latest().version());
    }

    @Test
    void versionsArePublishedInOrderWithoutGaps() throws Exception {
        List<CompletableFuture<ActionReport>> futures = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            futures.add(session.submit(GameAction.of(i % 2 == 0 ? alice : bob, ActionType.CHANGE_LIFE,
                    mapper.createObjectNode().put("delta", -1))));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(5, TimeUnit.SECONDS);

        for (int i = 0; i < published.size(); i++) {
            assertEquals(i + 1, published.get(i).version());
        }
        assertEquals(52, session.latest().version());
        assertEquals(-5, session.latest().state().requirePlayer(alice).getLifeTotal());
    }

    @Test
    void rejectedActionKeepsVersionAndDoesNotPublish() {
        int publishedBefore = published.size();

        ExecutionException error = assertThrows(ExecutionException.class, () -> session.submit(
                GameAction.of(alice, ActionType.TAP_CARD, mapper.createObjectNode().put("cardId", "missing")))
                .get(5, TimeUnit.SECONDS));

        assertEquals(ErrorKind.NOT_FOUND, ((GameException) error.getCause()).getKind());
        assertEquals(2, session.latest().version());
        assertEquals(publishedBefore, published.size());
    }

    @Test
    void snapshotJsonMatchesState() throws Exception {
        GameSnapshot latest = session.latest();

        GameState parsed = mapper.readValue(latest.json(), GameState.class);

        assertEquals(latest.state(), parsed);
        assertTrue(latest.json().contains("\"active_player_id\""));
        assertTrue(latest.json().contains("\"current_phase\":\"untap\""));
    }

    @Test
    void withLatestRunsAfterQueuedActions() throws Exception {
        session.submit(GameAction.of(alice, ActionType.CHANGE_LIFE, mapper.createObjectNode().put("delta", 5)));
        List<Long> seen = new ArrayList<>();

        session.withLatest(snapshot -> seen.add(snapshot.version())).get(5, TimeUnit.SECONDS);

        assertEquals(List.of(3L), seen);
    }

    @Test
    void closedSessionRejectsWithNotFound() {
        session.close();

        ExecutionException error = assertThrows(ExecutionException.class, () -> session.submit(
                GameAction.of(alice, ActionType.SHUFFLE, null)).get(5, TimeUnit.SECONDS));

        assertEquals(ErrorKind.NOT_FOUND, ((GameException) error.getCause()).getKind());
    }

    @Test
    void listenerFailureDoesNotRejectTheAction() throws Exception {
        GameSession failing = new GameSession(processor.newGame("GAME02", "x"), processor, mapper, snapshot -> {
            throw new IllegalStateException("listener down");
        });
        try {
            JoinResult joined = failing.join("Solo", 20).get(5, TimeUnit.SECONDS);
            assertEquals(1, joined.snapshot().version());
            assertEquals(1, failing.latest().version());
        } finally {
            failing.close();
        }
    }

    private String drawOneCard() throws Exception {
        DeckList deck = new DeckList("one", List.of("grizzly_bears"), List.of());
        session.submit(GameAction.of(alice, ActionType.LOAD_DECK, null).withDeck(deck)).get(5, TimeUnit.SECONDS);
        ActionReport report = session.submit(GameAction.of(alice, ActionType.DRAW, null)).get(5, TimeUnit.SECONDS);
        return report.snapshot().state().requirePlayer(alice).zone(ZoneType.HAND).getCards().get(0).getId();
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
