package com.tabletop.workstation.game;

import lombok.Data;

@Data
public class StoredSnapshot {
    private String gameId;
    private long version;
    private long savedAtEpochMs;
    private GameState state;

    public static StoredSnapshot of(GameSnapshot snapshot, long savedAtEpochMs) {
        StoredSnapshot stored = new StoredSnapshot();
        stored.setGameId(snapshot.gameId());
        stored.setVersion(snapshot.version());
        stored.setSavedAtEpochMs(savedAtEpochMs);
        stored.setState(snapshot.state());
        return stored;
    }
}
