package com.tabletop.workstation.game;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
@ConditionalOnProperty(name = "workstation.persistence.store", havingValue = "memory")
public class InMemorySnapshotStore implements SnapshotStore {

    private final Map<String, StoredSnapshot> snapshots = new ConcurrentHashMap<>();

    @Override
    public void save(GameSnapshot snapshot) {
        snapshots.put(snapshot.gameId(), StoredSnapshot.of(snapshot, System.currentTimeMillis()));
    }

    @Override
    public List<StoredSnapshot> loadAll() {
        return new ArrayList<>(snapshots.values());
    }

    @Override
    public void delete(String gameId) {
        snapshots.remove(gameId);
    }
}
