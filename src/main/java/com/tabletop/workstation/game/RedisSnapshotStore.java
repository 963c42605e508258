package com.tabletop.workstation.game;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * One key per game holding the latest snapshot, plus a set indexing the live game ids.
 */
@Component
@ConditionalOnProperty(name = "workstation.persistence.store", havingValue = "redis", matchIfMissing = true)
public class RedisSnapshotStore implements SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(RedisSnapshotStore.class);
    private final RedisTemplate<String, StoredSnapshot> snapshotRedisTemplate;
    private final StringRedisTemplate stringRedisTemplate;
    private final String keyPrefix;
    private final String indexKey;

    public RedisSnapshotStore(RedisTemplate<String, StoredSnapshot> snapshotRedisTemplate,
                              StringRedisTemplate stringRedisTemplate,
                              @Value("${workstation.persistence.key-prefix:mtg_game:}") String keyPrefix,
                              @Value("${workstation.persistence.index-key:mtg_active_games}") String indexKey) {
        this.snapshotRedisTemplate = snapshotRedisTemplate;
        this.stringRedisTemplate = stringRedisTemplate;
        this.keyPrefix = keyPrefix;
        this.indexKey = indexKey;
    }

    @Override
    public void save(GameSnapshot snapshot) {
        snapshotRedisTemplate.opsForValue().set(redisKey(snapshot.gameId()),
                StoredSnapshot.of(snapshot, System.currentTimeMillis()));
        stringRedisTemplate.opsForSet().add(indexKey, snapshot.gameId());
    }

    @Override
    public List<StoredSnapshot> loadAll() {
        Set<String> gameIds = stringRedisTemplate.opsForSet().members(indexKey);
        List<StoredSnapshot> snapshots = new ArrayList<>();
        if (gameIds == null) {
            return snapshots;
        }
        for (String gameId : gameIds) {
            StoredSnapshot stored = snapshotRedisTemplate.opsForValue().get(redisKey(gameId));
            if (stored == null || stored.getState() == null) {
                log.warn("snapshot-missing gameId={}, dropping from index", gameId);
                stringRedisTemplate.opsForSet().remove(indexKey, gameId);
                continue;
            }
            snapshots.add(stored);
        }
        return snapshots;
    }

    @Override
    public void delete(String gameId) {
        snapshotRedisTemplate.delete(redisKey(gameId));
        stringRedisTemplate.opsForSet().remove(indexKey, gameId);
    }

    private String redisKey(String gameId) {
        return keyPrefix + gameId;
    }
}
