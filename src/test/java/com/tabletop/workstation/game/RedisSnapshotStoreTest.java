package com.tabletop.workstation.game;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.SetOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RedisSnapshotStoreTest {

    @Mock
    private RedisTemplate<String, StoredSnapshot> snapshotRedisTemplate;

    @Mock
    private ValueOperations<String, StoredSnapshot> valueOperations;

    @Mock
    private StringRedisTemplate stringRedisTemplate;

    @Mock
    private SetOperations<String, String> setOperations;

    private RedisSnapshotStore store;

    @BeforeEach
    void setUp() {
        store = new RedisSnapshotStore(snapshotRedisTemplate, stringRedisTemplate, "mtg_game:", "mtg_active_games");
    }

    @Test
    void saveWritesSnapshotAndIndexesGame() {
        when(snapshotRedisTemplate.opsForValue()).thenReturn(valueOperations);
        when(stringRedisTemplate.opsForSet()).thenReturn(setOperations);
        GameState state = new GameState();
        state.setGameId("G1");

        store.save(new GameSnapshot("G1", 4, state, "{}"));

        ArgumentCaptor<StoredSnapshot> stored = ArgumentCaptor.forClass(StoredSnapshot.class);
        verify(valueOperations).set(eq("mtg_game:G1"), stored.capture());
        assertEquals(4, stored.getValue().getVersion());
        verify(setOperations).add("mtg_active_games", "G1");
    }

    @Test
    void loadAllSkipsAndUnindexesMissingEntries() {
        when(snapshotRedisTemplate.opsForValue()).thenReturn(valueOperations);
        when(stringRedisTemplate.opsForSet()).thenReturn(setOperations);
        when(setOperations.members("mtg_active_games")).thenReturn(new LinkedHashSet<>(List.of("G1", "G2")));
        StoredSnapshot g1 = new StoredSnapshot();
        g1.setGameId("G1");
        g1.setState(new GameState());
        when(valueOperations.get("mtg_game:G1")).thenReturn(g1);
        when(valueOperations.get("mtg_game:G2")).thenReturn(null);

        List<StoredSnapshot> loaded = store.loadAll();

        assertEquals(List.of(g1), loaded);
        verify(setOperations).remove("mtg_active_games", "G2");
    }

    @Test
    void deleteRemovesKeyAndIndexEntry() {
        when(stringRedisTemplate.opsForSet()).thenReturn(setOperations);

        store.delete("G1");

        verify(snapshotRedisTemplate).delete("mtg_game:G1");
        verify(setOperations).remove("mtg_active_games", "G1");
    }

    @Test
    void emptyIndexLoadsNothing() {
        when(stringRedisTemplate.opsForSet()).thenReturn(setOperations);
        when(setOperations.members("mtg_active_games")).thenReturn(Set.of());

        assertTrue(store.loadAll().isEmpty());
    }
}
