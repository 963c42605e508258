package com.tabletop.workstation.game;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum DieType {
    @JsonProperty("d4")
    D4(4),
    @JsonProperty("d6")
    D6(6),
    @JsonProperty("d8")
    D8(8),
    @JsonProperty("d10")
    D10(10),
    @JsonProperty("d12")
    D12(12),
    @JsonProperty("d20")
    D20(20);

    private final int sides;

    DieType(int sides) {
        this.sides = sides;
    }

    public int getSides() {
        return sides;
    }

    public static DieType fromWire(String value) {
        for (DieType type : values()) {
            if (type.name().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw GameException.invalidAction("Unknown die type: " + value);
    }
}
