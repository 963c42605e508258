package com.tabletop.workstation.game;

import java.util.List;

public record GameSummary(String gameId, String name, int playerCount, List<String> playerNames, long createdAt) {

    public static GameSummary of(GameState state) {
        List<String> names = state.getPlayers().values().stream().map(Player::getName).toList();
        return new GameSummary(state.getGameId(), state.getName(), names.size(), names, state.getCreatedAt());
    }
}
