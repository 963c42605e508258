package com.tabletop.workstation.game;

/**
 * A committed version of a game. {@code json} is the wire form of {@code state}, rendered once so
 * every client receives the same bytes for the same version.
 */
public record GameSnapshot(String gameId, long version, GameState state, String json) {
}
