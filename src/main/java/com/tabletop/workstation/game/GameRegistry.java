package com.tabletop.workstation.game;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live sessions by game id. Sessions are created here, rehydrated from the {@link SnapshotStore}
 * on startup and closed when the game is deleted or the process stops.
 */
@Slf4j
@Component
public class GameRegistry {

    private static final String GAME_ID_ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";
    private static final int GAME_ID_LENGTH = 6;

    private final Map<String, GameSession> sessions = new ConcurrentHashMap<>();
    private final Random random = new Random();
    private final ActionProcessor processor;
    private final ObjectMapper objectMapper;
    private final SnapshotStore snapshotStore;
    private final ApplicationEventPublisher events;

    public GameRegistry(ActionProcessor processor,
                        ObjectMapper objectMapper,
                        SnapshotStore snapshotStore,
                        ApplicationEventPublisher events) {
        this.processor = processor;
        this.objectMapper = objectMapper;
        this.snapshotStore = snapshotStore;
        this.events = events;
    }

    @PostConstruct
    public void rehydrate() {
        try {
            for (StoredSnapshot stored : snapshotStore.loadAll()) {
                GameState state = stored.getState();
                state.setVersion(stored.getVersion());
                sessions.put(state.getGameId(), open(state));
            }
            log.info("games-rehydrated count={}", sessions.size());
        } catch (RuntimeException e) {
            // same as a store that is down: start empty and keep serving from memory
            log.warn("snapshot store unavailable, starting without stored games: {}", e.getMessage());
        }
    }

    public GameSession create(String name) {
        for (int attempt = 0; attempt < 1000; attempt++) {
            String gameId = generateGameId();
            if (sessions.containsKey(gameId)) {
                continue;
            }
            GameSession session = open(processor.newGame(gameId, name));
            if (sessions.putIfAbsent(gameId, session) == null) {
                log.info("game-created gameId={} name={}", gameId, name);
                return session;
            }
            session.close();
        }
        GameSession session = open(processor.newGame(UUID.randomUUID().toString(), name));
        sessions.put(session.getGameId(), session);
        return session;
    }

    public Optional<GameSession> find(String gameId) {
        return gameId == null ? Optional.empty() : Optional.ofNullable(sessions.get(gameId));
    }

    public GameSession require(String gameId) {
        return find(gameId).orElseThrow(() -> GameException.notFound("Game not found: " + gameId));
    }

    public boolean contains(String gameId) {
        return gameId != null && sessions.containsKey(gameId);
    }

    public Collection<GameSession> list() {
        return new ArrayList<>(sessions.values());
    }

    public void delete(String gameId) {
        GameSession session = sessions.remove(gameId);
        if (session == null) {
            throw GameException.notFound("Game not found: " + gameId);
        }
        session.close();
        events.publishEvent(new GameDeletedEvent(gameId));
        log.info("game-deleted gameId={}", gameId);
    }

    private GameSession open(GameState state) {
        return new GameSession(state, processor, objectMapper,
                snapshot -> events.publishEvent(new SnapshotPublishedEvent(snapshot)));
    }

    private String generateGameId() {
        StringBuilder builder = new StringBuilder(GAME_ID_LENGTH);
        for (int i = 0; i < GAME_ID_LENGTH; i++) {
            builder.append(GAME_ID_ALPHABET.charAt(random.nextInt(GAME_ID_ALPHABET.length())));
        }
        return builder.toString();
    }

    @PreDestroy
    public void shutdown() {
        for (GameSession session : sessions.values()) {
            session.close();
        }
    }
}
