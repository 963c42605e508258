package com.tabletop.workstation.game;

import lombok.Data;

@Data
public class RejoinRequest {
    private String playerId;
}
