package com.tabletop.workstation.game;

import lombok.Data;

@Data
public class ChatMessage {
    private String playerId;
    private String playerName;
    private String message;
    private String timestamp;
}
