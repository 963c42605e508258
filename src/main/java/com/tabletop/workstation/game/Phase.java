package com.tabletop.workstation.game;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Turn structure. The cycle does not wrap on its own: cleanup is left by an explicit next turn.
 */
public enum Phase {
    @JsonProperty("untap")
    UNTAP,
    @JsonProperty("upkeep")
    UPKEEP,
    @JsonProperty("draw")
    DRAW,
    @JsonProperty("main_1")
    MAIN_1,
    @JsonProperty("begin_combat")
    BEGIN_COMBAT,
    @JsonProperty("declare_attackers")
    DECLARE_ATTACKERS,
    @JsonProperty("declare_blockers")
    DECLARE_BLOCKERS,
    @JsonProperty("damage")
    DAMAGE,
    @JsonProperty("end_combat")
    END_COMBAT,
    @JsonProperty("main_2")
    MAIN_2,
    @JsonProperty("end_step")
    END_STEP,
    @JsonProperty("cleanup")
    CLEANUP;

    public Phase next() {
        if (this == CLEANUP) {
            return CLEANUP;
        }
        return values()[ordinal() + 1];
    }
}
