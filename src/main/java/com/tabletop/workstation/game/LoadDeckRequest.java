package com.tabletop.workstation.game;

import lombok.Data;

@Data
public class LoadDeckRequest {
    private String deckName;
}
