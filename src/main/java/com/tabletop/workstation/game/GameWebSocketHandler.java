package com.tabletop.workstation.game;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriTemplate;

import java.io.IOException;
import java.net.URI;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Socket endpoint {@code /ws/{gameId}/{playerId}}. The connection is bound to the pair in its URL;
 * actions carry no ids of their own. On connect the player gets the current snapshot before any
 * later broadcast.
 */
@Slf4j
@Component
public class GameWebSocketHandler extends TextWebSocketHandler {

    static final UriTemplate PATH = new UriTemplate("/ws/{gameId}/{playerId}");
    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private final SessionRecoveryService sessionRecovery;
    private final GameService gameService;
    private final ConnectionHub hub;
    private final ObjectMapper objectMapper;
    private final int sendTimeLimitMs;
    private final int bufferSizeBytes;

    // raw session id -> decorated session used for every send
    private final Map<String, WebSocketSession> decorated = new ConcurrentHashMap<>();

    public GameWebSocketHandler(SessionRecoveryService sessionRecovery,
                                GameService gameService,
                                ConnectionHub hub,
                                ObjectMapper objectMapper,
                                @Value("${workstation.ws.send-time-limit-ms:5000}") int sendTimeLimitMs,
                                @Value("${workstation.ws.buffer-size-bytes:1048576}") int bufferSizeBytes) {
        this.sessionRecovery = sessionRecovery;
        this.gameService = gameService;
        this.hub = hub;
        this.objectMapper = objectMapper;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.bufferSizeBytes = bufferSizeBytes;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        Map<String, String> ids = parsePath(session.getUri());
        String gameId = ids.get("gameId");
        String playerId = ids.get("playerId");

        GameSession game;
        try {
            game = sessionRecovery.resume(gameId, playerId);
        } catch (GameException e) {
            log.info("socket-refused gameId={} playerId={}: {}", gameId, playerId, e.getMessage());
            hub.sendError(session, e);
            session.close(CloseStatus.POLICY_VIOLATION.withReason(e.getKind().name()));
            return;
        }

        WebSocketSession socket = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeBytes);
        decorated.put(session.getId(), socket);
        // actions can arrive before the bootstrap task has run
        socket.getAttributes().put(ConnectionHub.GAME_ID_ATTRIBUTE, gameId);
        socket.getAttributes().put(ConnectionHub.PLAYER_ID_ATTRIBUTE, playerId);
        game.withLatest(snapshot -> {
            hub.register(gameId, playerId, socket);
            hub.sendSnapshot(socket, snapshot);
        }).whenComplete((snapshot, error) -> {
            if (error != null) {
                log.warn("socket-bootstrap failed gameId={} playerId={}: {}", gameId, playerId, error.getMessage());
                closeQuietly(socket, CloseStatus.SERVER_ERROR);
            }
        });
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        WebSocketSession socket = decorated.getOrDefault(session.getId(), session);
        String gameId = (String) socket.getAttributes().get(ConnectionHub.GAME_ID_ATTRIBUTE);
        String playerId = (String) socket.getAttributes().get(ConnectionHub.PLAYER_ID_ATTRIBUTE);
        if (gameId == null || playerId == null) {
            hub.sendError(socket, ErrorKind.INVALID_ACTION.name(), "Connection is not bound to a game yet");
            return;
        }

        ActionMessage action;
        try {
            action = objectMapper.readValue(message.getPayload(), ActionMessage.class);
        } catch (JsonProcessingException e) {
            hub.sendError(socket, ErrorKind.INVALID_ACTION.name(), "Malformed message");
            return;
        }

        gameService.submit(gameId, playerId, action).whenComplete((report, error) -> {
            if (error == null) {
                if (report.outcome().isPartialDraw()) {
                    log.debug("partial-draw gameId={} playerId={} requested={} actual={}",
                            gameId, playerId, report.outcome().requested(), report.outcome().actual());
                }
                return;
            }
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause()
                    : error;
            if (cause instanceof GameException rejection) {
                hub.sendError(socket, rejection);
            } else {
                log.error("action failed gameId={} playerId={}", gameId, playerId, cause);
                hub.sendError(socket, INTERNAL_ERROR, "Unexpected server error");
            }
        });
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("socket transport error sessionId={}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        WebSocketSession socket = decorated.remove(session.getId());
        hub.unregister(socket != null ? socket : session);
    }

    static Map<String, String> parsePath(URI uri) {
        if (uri == null || !PATH.matches(uri.getPath())) {
            return Map.of();
        }
        return PATH.match(uri.getPath());
    }

    private void closeQuietly(WebSocketSession socket, CloseStatus status) {
        try {
            socket.close(status);
        } catch (IOException e) {
            log.debug("socket-close failed sessionId={}: {}", socket.getId(), e.getMessage());
        }
    }
}
