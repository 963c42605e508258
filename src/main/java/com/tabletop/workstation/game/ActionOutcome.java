package com.tabletop.workstation.game;

public record ActionOutcome(Kind kind, int requested, int actual) {

    public enum Kind {
        APPLIED,
        PARTIAL_DRAW
    }

    private static final ActionOutcome APPLIED = new ActionOutcome(Kind.APPLIED, 0, 0);

    public static ActionOutcome applied() {
        return APPLIED;
    }

    public static ActionOutcome drew(int requested, int actual) {
        if (actual < requested) {
            return new ActionOutcome(Kind.PARTIAL_DRAW, requested, actual);
        }
        return new ActionOutcome(Kind.APPLIED, requested, actual);
    }

    public boolean isPartialDraw() {
        return kind == Kind.PARTIAL_DRAW;
    }
}
