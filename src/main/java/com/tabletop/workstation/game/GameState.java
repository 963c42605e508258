package com.tabletop.workstation.game;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Full state of one match. Instances published in a snapshot are never mutated again;
 * every transition works on a {@link #copy()}.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class GameState {
    public static final int MAX_PLAYERS = 2;

    private String gameId;
    private String name;
    private long createdAt;
    private long version;
    private String activePlayerId;
    private int turnNumber = 1;
    private Phase currentPhase = Phase.UNTAP;
    private Map<String, Player> players = new LinkedHashMap<>();
    private List<DiceToken> diceTokens = new ArrayList<>();
    private List<TargetingArrow> targetingArrows = new ArrayList<>();
    private List<ChatMessage> chatMessages = new ArrayList<>();

    public Optional<CardLocation> findCard(String cardId) {
        if (cardId == null) {
            return Optional.empty();
        }
        for (Player player : players.values()) {
            for (Zone zone : player.getZones().values()) {
                for (Card card : zone.getCards()) {
                    if (cardId.equals(card.getId())) {
                        return Optional.of(new CardLocation(player, zone, card));
                    }
                }
            }
        }
        return Optional.empty();
    }

    public CardLocation requireCard(String cardId) {
        return findCard(cardId).orElseThrow(() -> GameException.notFound("Card not found: " + cardId));
    }

    public Player requirePlayer(String playerId) {
        Player player = playerId == null ? null : players.get(playerId);
        if (player == null) {
            throw GameException.notFound("Player not found: " + playerId);
        }
        return player;
    }

    public boolean hasPlayer(String playerId) {
        return playerId != null && players.containsKey(playerId);
    }

    /**
     * The participant that is not {@code playerId}; with a single participant that one is returned.
     */
    public String opponentOf(String playerId) {
        for (String id : players.keySet()) {
            if (!id.equals(playerId)) {
                return id;
            }
        }
        return playerId;
    }

    public GameState copy() {
        GameState copy = new GameState();
        copy.setGameId(gameId);
        copy.setName(name);
        copy.setCreatedAt(createdAt);
        copy.setVersion(version);
        copy.setActivePlayerId(activePlayerId);
        copy.setTurnNumber(turnNumber);
        copy.setCurrentPhase(currentPhase);
        for (Map.Entry<String, Player> entry : players.entrySet()) {
            copy.getPlayers().put(entry.getKey(), entry.getValue().copy());
        }
        for (DiceToken die : diceTokens) {
            copy.getDiceTokens().add(die.copy());
        }
        // arrows and chat entries are never edited in place
        copy.getTargetingArrows().addAll(targetingArrows);
        copy.getChatMessages().addAll(chatMessages);
        return copy;
    }
}
