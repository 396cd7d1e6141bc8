package io.deltaflow.core;

import org.junit.jupiter.api.Test;

import java.util.HashMap;

import static org.junit.jupiter.api.Assertions.*;

class KeyHashingTest {

    @Test
    void same_key_always_maps_to_same_shard() {
        for (int i = 0; i < 1_000; i++) {
            String key = "user:" + i;
            assertEquals(KeyHashing.shardFor(key, 8), KeyHashing.shardFor(key, 8));
        }
        assertEquals(KeyHashing.tokenForKey("user:42"), KeyHashing.tokenForKey("user:42"));
    }

    @Test
    void shard_share_is_roughly_uniform() {
        int shards = 4;
        var counts = new HashMap<Integer, Integer>();
        int n = 100_000;
        for (int i = 0; i < n; i++) {
            counts.merge(KeyHashing.shardFor("k-" + i, shards), 1, Integer::sum);
        }
        assertEquals(shards, counts.size());
        for (int s = 0; s < shards; s++) {
            double p = counts.get(s) / (double) n;
            // ~25% each, allow ±5%
            assertTrue(Math.abs(p - 0.25) < 0.05, "shard " + s + " share=" + p);
        }
    }

    @Test
    void edge_cases() {
        assertEquals(0, KeyHashing.shardFor("anything", 1));
        assertThrows(IllegalArgumentException.class, () -> KeyHashing.shardFor("x", 0));
        int s = KeyHashing.shardFor("", 3);
        assertTrue(s >= 0 && s < 3);
    }
}
