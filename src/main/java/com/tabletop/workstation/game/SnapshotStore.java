package com.tabletop.workstation.game;

import java.util.List;

/**
 * Durable copy of the latest snapshot of every live game, read back on startup.
 */
public interface SnapshotStore {

    void save(GameSnapshot snapshot);

    List<StoredSnapshot> loadAll();

    void delete(String gameId);
}
