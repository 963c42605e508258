package com.tabletop.workstation.game;

import java.util.Locale;

public enum ActionType {
    MOVE_CARD,
    TAP_CARD,
    TOGGLE_FACE,
    ATTACH_CARD,
    UNATTACH_CARD,
    ADD_COUNTER,
    DRAW,
    SHUFFLE,
    MULLIGAN,
    NEXT_PHASE,
    NEXT_TURN,
    CHANGE_LIFE,
    SET_LIFE,
    UNTAP_ALL,
    CREATE_TOKEN,
    CREATE_DIE,
    ROLL_DIE,
    MOVE_DIE,
    REMOVE_DIE,
    REORDER_HAND,
    SEND_CHAT,
    ADD_ARROW,
    REMOVE_ARROW,
    CLEAR_ARROWS,
    LOAD_DECK;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ActionType fromWire(String action) {
        if (action == null || action.isBlank()) {
            throw GameException.invalidAction("Action is required");
        }
        for (ActionType type : values()) {
            if (type.wireName().equals(action.trim().toLowerCase(Locale.ROOT))) {
                return type;
            }
        }
        throw GameException.invalidAction("Unknown action: " + action);
    }
}
