package com.tabletop.workstation.game;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Authoritative owner of one game. All mutations run on a single mailbox thread in arrival order;
 * each successful one bumps the version and is handed to the publisher before the caller's future
 * completes. Publishing happens on the mailbox thread, so listeners see versions in order.
 */
@Slf4j
public class GameSession implements AutoCloseable {

    private final String gameId;
    private final ActionProcessor processor;
    private final ObjectMapper objectMapper;
    private final Consumer<GameSnapshot> publisher;
    private final ExecutorService mailbox;
    private volatile GameSnapshot latest;

    public GameSession(GameState initial,
                       ActionProcessor processor,
                       ObjectMapper objectMapper,
                       Consumer<GameSnapshot> publisher) {
        this.gameId = initial.getGameId();
        this.processor = processor;
        this.objectMapper = objectMapper;
        this.publisher = publisher;
        this.mailbox = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "game-" + gameId);
            thread.setDaemon(true);
            return thread;
        });
        this.latest = render(initial);
    }

    public String getGameId() {
        return gameId;
    }

    public GameSnapshot latest() {
        return latest;
    }

    public CompletableFuture<ActionReport> submit(GameAction action) {
        return enqueue(() -> {
            ActionResult result = processor.apply(latest.state(), action);
            GameSnapshot snapshot = commit(result.state());
            log.debug("action-applied gameId={} playerId={} action={} version={}",
                    gameId, action.getPlayerId(), action.getType().wireName(), snapshot.version());
            return new ActionReport(snapshot, result.outcome());
        });
    }

    public CompletableFuture<JoinResult> join(String playerName, int startingLife) {
        return enqueue(() -> {
            String playerId = UUID.randomUUID().toString();
            ActionResult result = processor.addPlayer(latest.state(), playerId, playerName, startingLife);
            GameSnapshot snapshot = commit(result.state());
            log.info("player-joined gameId={} playerId={} name={}", gameId, playerId, playerName);
            return new JoinResult(playerId, snapshot);
        });
    }

    /**
     * Runs {@code consumer} with the current snapshot on the mailbox thread, so nothing published
     * afterwards can overtake it.
     */
    public CompletableFuture<GameSnapshot> withLatest(Consumer<GameSnapshot> consumer) {
        return enqueue(() -> {
            GameSnapshot current = latest;
            consumer.accept(current);
            return current;
        });
    }

    private <T> CompletableFuture<T> enqueue(Supplier<T> task) {
        try {
            return CompletableFuture.supplyAsync(task, mailbox);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(GameException.notFound("Game not found: " + gameId));
        }
    }

    private GameSnapshot commit(GameState next) {
        next.setVersion(latest.version() + 1);
        GameSnapshot snapshot = render(next);
        latest = snapshot;
        try {
            publisher.accept(snapshot);
        } catch (RuntimeException e) {
            // the mutation is committed; a listener failure must not turn it into a rejection
            log.error("snapshot-publish failed gameId={} version={}", gameId, snapshot.version(), e);
        }
        return snapshot;
    }

    private GameSnapshot render(GameState state) {
        try {
            return new GameSnapshot(gameId, state.getVersion(), state, objectMapper.writeValueAsString(state));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize game " + gameId, e);
        }
    }

    @Override
    public void close() {
        mailbox.shutdown();
        try {
            if (!mailbox.awaitTermination(3, TimeUnit.SECONDS)) {
                mailbox.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            mailbox.shutdownNow();
        }
    }
}
