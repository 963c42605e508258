package com.tabletop.workstation.game;

public record SnapshotPublishedEvent(GameSnapshot snapshot) {
}
