package com.tabletop.workstation.game;

public record ActionResult(GameState state, ActionOutcome outcome) {
}
