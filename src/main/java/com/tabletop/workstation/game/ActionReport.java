package com.tabletop.workstation.game;

public record ActionReport(GameSnapshot snapshot, ActionOutcome outcome) {
}
