package com.tabletop.workstation.game;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

public enum ZoneType {
    @JsonProperty("library")
    LIBRARY(true),
    @JsonProperty("hand")
    HAND(true),
    @JsonProperty("battlefield")
    BATTLEFIELD(false),
    @JsonProperty("graveyard")
    GRAVEYARD(false),
    @JsonProperty("exile")
    EXILE(false),
    @JsonProperty("sideboard")
    SIDEBOARD(false);

    private final boolean ordered;

    ZoneType(boolean ordered) {
        this.ordered = ordered;
    }

    public boolean isOrdered() {
        return ordered;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ZoneType fromWire(String value) {
        if (value == null) {
            throw GameException.invalidAction("Zone is required");
        }
        for (ZoneType type : values()) {
            if (type.wireName().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw GameException.invalidAction("Unknown zone: " + value);
    }
}
