package com.tabletop.workstation.game;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Writes published snapshots to the {@link SnapshotStore} off the mailbox threads. Only the newest
 * pending version of a game is kept; a failed write stays pending and is retried on the next flush.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SnapshotPersister {

    private final SnapshotStore snapshotStore;
    private final GameRegistry gameRegistry;
    private final Map<String, GameSnapshot> pending = new ConcurrentHashMap<>();

    @EventListener
    public void onSnapshot(SnapshotPublishedEvent event) {
        GameSnapshot snapshot = event.snapshot();
        pending.merge(snapshot.gameId(), snapshot,
                (current, incoming) -> incoming.version() >= current.version() ? incoming : current);
    }

    @EventListener
    public synchronized void onGameDeleted(GameDeletedEvent event) {
        pending.remove(event.gameId());
        try {
            snapshotStore.delete(event.gameId());
        } catch (RuntimeException e) {
            log.warn("snapshot-delete failed gameId={}: {}", event.gameId(), e.getMessage());
        }
    }

    @Scheduled(fixedDelayString = "${workstation.persistence.flush-ms:500}")
    public synchronized void flush() {
        for (GameSnapshot snapshot : new ArrayList<>(pending.values())) {
            if (!gameRegistry.contains(snapshot.gameId())) {
                pending.remove(snapshot.gameId(), snapshot);
                continue;
            }
            try {
                snapshotStore.save(snapshot);
                pending.remove(snapshot.gameId(), snapshot);
            } catch (RuntimeException e) {
                log.warn("snapshot-save failed gameId={} version={}: {}",
                        snapshot.gameId(), snapshot.version(), e.getMessage());
            }
        }
    }

    public int pendingCount() {
        return pending.size();
    }

    @PreDestroy
    public void flushOnShutdown() {
        flush();
        if (!pending.isEmpty()) {
            log.warn("shutdown with {} unsaved snapshots", pending.size());
        }
    }
}
