package com.tabletop.workstation.game;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.util.RawValue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live sockets per game, keyed by player id. A player may hold several sockets (browser tabs).
 * Snapshots go to every socket of the game; errors only to the socket that caused them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConnectionHub {

    public static final String GAME_ID_ATTRIBUTE = "gameId";
    public static final String PLAYER_ID_ATTRIBUTE = "playerId";
    public static final String SNAPSHOT_FRAME_TYPE = "game_state_update";
    public static final String ERROR_FRAME_TYPE = "error";

    private final ObjectMapper objectMapper;

    // gameId -> playerId -> sockets
    private final Map<String, Map<String, Set<WebSocketSession>>> rooms = new ConcurrentHashMap<>();

    public void register(String gameId, String playerId, WebSocketSession session) {
        session.getAttributes().put(GAME_ID_ATTRIBUTE, gameId);
        session.getAttributes().put(PLAYER_ID_ATTRIBUTE, playerId);
        rooms.computeIfAbsent(gameId, id -> new ConcurrentHashMap<>())
                .computeIfAbsent(playerId, id -> ConcurrentHashMap.newKeySet())
                .add(session);
        log.info("socket-registered gameId={} playerId={} sessionId={}", gameId, playerId, session.getId());
    }

    public void unregister(WebSocketSession session) {
        String gameId = (String) session.getAttributes().get(GAME_ID_ATTRIBUTE);
        String playerId = (String) session.getAttributes().get(PLAYER_ID_ATTRIBUTE);
        if (gameId == null || playerId == null) {
            return;
        }
        rooms.computeIfPresent(gameId, (gid, players) -> {
            players.computeIfPresent(playerId, (pid, sockets) -> {
                sockets.removeIf(socket -> socket.getId().equals(session.getId()));
                return sockets.isEmpty() ? null : sockets;
            });
            return players.isEmpty() ? null : players;
        });
        log.info("socket-unregistered gameId={} playerId={} sessionId={}", gameId, playerId, session.getId());
    }

    public int connectionCount(String gameId) {
        Map<String, Set<WebSocketSession>> players = rooms.get(gameId);
        if (players == null) {
            return 0;
        }
        return players.values().stream().mapToInt(Set::size).sum();
    }

    @EventListener
    public void onSnapshot(SnapshotPublishedEvent event) {
        broadcast(event.snapshot());
    }

    @EventListener
    public void onGameDeleted(GameDeletedEvent event) {
        Map<String, Set<WebSocketSession>> players = rooms.remove(event.gameId());
        if (players == null) {
            return;
        }
        for (Set<WebSocketSession> sockets : players.values()) {
            for (WebSocketSession socket : sockets) {
                try {
                    socket.close(CloseStatus.GOING_AWAY.withReason("Game deleted"));
                } catch (IOException e) {
                    log.debug("socket-close failed sessionId={}: {}", socket.getId(), e.getMessage());
                }
            }
        }
    }

    public void broadcast(GameSnapshot snapshot) {
        Map<String, Set<WebSocketSession>> players = rooms.get(snapshot.gameId());
        if (players == null) {
            return;
        }
        TextMessage frame = snapshotFrame(snapshot);
        for (Set<WebSocketSession> sockets : players.values()) {
            for (WebSocketSession socket : sockets) {
                send(socket, frame);
            }
        }
    }

    public void sendSnapshot(WebSocketSession session, GameSnapshot snapshot) {
        send(session, snapshotFrame(snapshot));
    }

    public void sendError(WebSocketSession session, String code, String message) {
        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("type", ERROR_FRAME_TYPE);
        frame.put("code", code);
        frame.put("message", message);
        send(session, toText(frame));
    }

    public void sendError(WebSocketSession session, GameException error) {
        sendError(session, error.getKind().name(), error.getMessage());
    }

    TextMessage snapshotFrame(GameSnapshot snapshot) {
        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("type", SNAPSHOT_FRAME_TYPE);
        frame.putRawValue("state", new RawValue(snapshot.json()));
        return toText(frame);
    }

    private TextMessage toText(ObjectNode frame) {
        try {
            return new TextMessage(objectMapper.writeValueAsString(frame));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize frame", e);
        }
    }

    private void send(WebSocketSession session, TextMessage frame) {
        if (!session.isOpen()) {
            unregister(session);
            return;
        }
        try {
            session.sendMessage(frame);
        } catch (IOException | RuntimeException e) {
            log.warn("socket-send failed sessionId={}: {}", session.getId(), e.getMessage());
            unregister(session);
        }
    }
}
