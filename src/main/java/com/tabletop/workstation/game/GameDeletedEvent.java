package com.tabletop.workstation.game;

public record GameDeletedEvent(String gameId) {
}
