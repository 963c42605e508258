package com.tabletop.workstation.game;

import lombok.Data;

@Data
public class TargetingArrow {
    private String id;
    private String ownerPlayerId;
    private String cardId;
    private String targetCardId;
    private String targetPlayerId;
}
