package com.tabletop.workstation.game;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Entry point for the REST and socket layers. Everything that touches a game goes through its
 * {@link GameSession}; this class only resolves ids, decks and defaults.
 */
@Slf4j
@Service
public class GameService {

    private static final long AWAIT_SECONDS = 10;

    private final GameRegistry gameRegistry;
    private final SessionRecoveryService sessionRecovery;
    private final DeckService deckService;
    private final int startingLife;

    public GameService(GameRegistry gameRegistry,
                       SessionRecoveryService sessionRecovery,
                       DeckService deckService,
                       @Value("${workstation.engine.starting-life:20}") int startingLife) {
        this.gameRegistry = gameRegistry;
        this.sessionRecovery = sessionRecovery;
        this.deckService = deckService;
        this.startingLife = startingLife;
    }

    public JoinGameResponse createGame(CreateGameRequest request) {
        String playerName = requireName(request.getPlayerName());
        // resolve the deck first so an unknown deck does not leave an empty game behind
        DeckList deck = request.getDeckName() == null ? null : deckService.require(request.getDeckName());
        String gameName = request.getGameName() == null || request.getGameName().isBlank()
                ? playerName + "'s game"
                : request.getGameName().trim();
        int life = request.getStartingLife() == null ? startingLife : request.getStartingLife();

        GameSession session = gameRegistry.create(gameName);
        JoinResult joined = await(session.join(playerName, life));
        GameSnapshot snapshot = deck == null
                ? joined.snapshot()
                : await(session.submit(loadDeckAction(joined.playerId(), deck))).snapshot();
        return JoinGameResponse.of(joined.playerId(), snapshot);
    }

    public JoinGameResponse joinGame(String gameId, JoinGameRequest request) {
        String playerName = requireName(request.getPlayerName());
        DeckList deck = request.getDeckName() == null ? null : deckService.require(request.getDeckName());
        GameSession session = gameRegistry.require(gameId);

        JoinResult joined = await(session.join(playerName, startingLife));
        GameSnapshot snapshot = deck == null
                ? joined.snapshot()
                : await(session.submit(loadDeckAction(joined.playerId(), deck))).snapshot();
        return JoinGameResponse.of(joined.playerId(), snapshot);
    }

    public JoinGameResponse rejoinGame(String gameId, String playerId) {
        GameSnapshot snapshot = sessionRecovery.snapshot(gameId, playerId);
        log.info("player-rejoined gameId={} playerId={} version={}", gameId, playerId, snapshot.version());
        return JoinGameResponse.of(playerId, snapshot);
    }

    public GameSnapshot getState(String gameId, String playerId) {
        if (playerId == null) {
            return gameRegistry.require(gameId).latest();
        }
        return sessionRecovery.snapshot(gameId, playerId);
    }

    public List<GameSummary> listGames() {
        return gameRegistry.list().stream()
                .map(session -> GameSummary.of(session.latest().state()))
                .sorted(Comparator.comparingLong(GameSummary::createdAt))
                .toList();
    }

    public void deleteGame(String gameId) {
        gameRegistry.delete(gameId);
    }

    public GameSnapshot loadDeck(String gameId, String playerId, String deckName) {
        GameSession session = sessionRecovery.resume(gameId, playerId);
        DeckList deck = deckService.require(deckName);
        return await(session.submit(loadDeckAction(playerId, deck))).snapshot();
    }

    /**
     * Queues an action from a connected player. The returned future fails with a
     * {@link GameException} when the engine rejects it.
     */
    public CompletableFuture<ActionReport> submit(String gameId, String playerId, ActionMessage message) {
        GameSession session;
        GameAction action;
        try {
            session = sessionRecovery.resume(gameId, playerId);
            action = toAction(playerId, message);
        } catch (GameException e) {
            return CompletableFuture.failedFuture(e);
        }
        return session.submit(action);
    }

    private GameAction toAction(String playerId, ActionMessage message) {
        if (message == null || message.getAction() == null) {
            throw GameException.invalidAction("Missing action");
        }
        ActionType type = ActionType.fromWire(message.getAction());
        GameAction action = GameAction.of(playerId, type, message.getData());
        if (type == ActionType.LOAD_DECK) {
            String deckName = message.getData() == null || !message.getData().hasNonNull("deckName")
                    ? null
                    : message.getData().get("deckName").asText();
            if (deckName == null || deckName.isBlank()) {
                throw GameException.invalidAction("Missing field: deckName");
            }
            action = action.withDeck(deckService.require(deckName));
        }
        return action;
    }

    private GameAction loadDeckAction(String playerId, DeckList deck) {
        return GameAction.of(playerId, ActionType.LOAD_DECK, null).withDeck(deck);
    }

    private String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw GameException.invalidAction("Player name is required");
        }
        return name.trim();
    }

    static <T> T await(CompletableFuture<T> future) {
        try {
            return future.get(AWAIT_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException | CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException(cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the game", e);
        } catch (TimeoutException e) {
            throw new IllegalStateException("Game did not respond in time", e);
        }
    }
}
