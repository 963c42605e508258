package com.tabletop.workstation.game;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

/**
 * One inbound action, bound to the player whose socket sent it.
 */
@Value
public class GameAction {
    String playerId;
    ActionType type;
    JsonNode data;
    DeckList deck;      // only for load_deck

    public static GameAction of(String playerId, ActionType type, JsonNode data) {
        return new GameAction(playerId, type, data, null);
    }

    public GameAction withDeck(DeckList deck) {
        return new GameAction(playerId, type, data, deck);
    }
}
