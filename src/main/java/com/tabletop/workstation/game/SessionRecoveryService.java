package com.tabletop.workstation.game;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Resolves a remembered (gameId, playerId) pair back to the current snapshot. Never adds a player:
 * a pair that is not already seated is refused.
 */
@Service
@RequiredArgsConstructor
public class SessionRecoveryService {

    private final GameRegistry gameRegistry;

    public GameSession resume(String gameId, String playerId) {
        GameSession session = gameRegistry.require(gameId);
        if (!session.latest().state().hasPlayer(playerId)) {
            throw GameException.notFound("Player " + playerId + " is not part of game " + gameId);
        }
        return session;
    }

    public GameSnapshot snapshot(String gameId, String playerId) {
        return resume(gameId, playerId).latest();
    }
}
