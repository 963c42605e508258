package com.tabletop.workstation.game;

public record JoinResult(String playerId, GameSnapshot snapshot) {
}
