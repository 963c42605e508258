package com.tabletop.workstation.game;

import lombok.Data;

@Data
public class JoinGameRequest {
    private String playerName;
    private String deckName;
}
