package com.tabletop.workstation.game;

import lombok.Data;

@Data
public class DiceToken {
    private String id;
    private String ownerPlayerId;
    private DieType dieType;
    private int x;
    private int y;
    private Integer value;        // null while pending
    private Long lastRolledAt;

    public DiceToken copy() {
        DiceToken copy = new DiceToken();
        copy.setId(id);
        copy.setOwnerPlayerId(ownerPlayerId);
        copy.setDieType(dieType);
        copy.setX(x);
        copy.setY(y);
        copy.setValue(value);
        copy.setLastRolledAt(lastRolledAt);
        return copy;
    }
}
