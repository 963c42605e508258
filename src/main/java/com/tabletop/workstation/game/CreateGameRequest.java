package com.tabletop.workstation.game;

import lombok.Data;

@Data
public class CreateGameRequest {
    private String playerName;
    private String gameName;
    private Integer startingLife;
    private String deckName;
}
