package com.tabletop.workstation.game;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Zone {
    private ZoneType zoneType;
    private String playerId;
    private List<Card> cards = new ArrayList<>();

    public Zone() {
    }

    public Zone(ZoneType zoneType, String playerId) {
        this.zoneType = zoneType;
        this.playerId = playerId;
    }

    /**
     * Inserts at {@code index} (clamped) or appends when no index is given.
     */
    public void insert(Card card, Integer index) {
        if (index == null || index >= cards.size()) {
            cards.add(card);
        } else {
            cards.add(Math.max(0, index), card);
        }
    }

    public int indexOf(String cardId) {
        for (int i = 0; i < cards.size(); i++) {
            if (cards.get(i).getId().equals(cardId)) {
                return i;
            }
        }
        return -1;
    }

    public Zone copy() {
        Zone copy = new Zone(zoneType, playerId);
        for (Card card : cards) {
            copy.getCards().add(card.copy());
        }
        return copy;
    }
}
