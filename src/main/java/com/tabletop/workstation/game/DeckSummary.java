package com.tabletop.workstation.game;

public record DeckSummary(String name, String deckKey, int mainCount, int sideboardCount) {
}
