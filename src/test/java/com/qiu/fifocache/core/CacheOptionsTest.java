package com.qiu.fifocache.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CacheOptionsTest {

    @Test
    void testDefaults() {
        CacheOptions options = CacheOptions.defaultOptions();
        assertEquals(CacheOptions.DEFAULT_MAX_ENTRIES, options.getMaxEntries());
        assertEquals(CacheOptions.DEFAULT_SHARD_COUNT, options.getShardCount());
    }

    @Test
    void testBuilder() {
        CacheOptions options = CacheOptions.builder()
                .maxEntries(5000)
                .shardCount(8)
                .build();
        assertEquals(5000, options.getMaxEntries());
        assertEquals(8, options.getShardCount());

        CacheOptions onlyEntries = CacheOptions.withMaxEntries(42);
        assertEquals(42, onlyEntries.getMaxEntries());
        assertEquals(CacheOptions.DEFAULT_SHARD_COUNT, onlyEntries.getShardCount());
    }

    @Test
    void testSlotsPerShardRoundsUp() {
        assertEquals(125, CacheOptions.builder().maxEntries(2000).shardCount(16).build().getSlotsPerShard());
        assertEquals(3, CacheOptions.builder().maxEntries(10).shardCount(4).build().getSlotsPerShard());
        // 容量小于分片数时每个分片至少一个槽位
        assertEquals(1, CacheOptions.builder().maxEntries(3).shardCount(16).build().getSlotsPerShard());
    }

    @Test
    void testInvalidValues() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> CacheOptions.builder().maxEntries(0));
        assertTrue(e.getMessage().contains("got 0"));
        assertThrows(IllegalArgumentException.class, () -> CacheOptions.withMaxEntries(-1));
        assertThrows(IllegalArgumentException.class, () -> CacheOptions.builder().shardCount(0));
        assertThrows(IllegalArgumentException.class, () -> CacheOptions.builder().shardCount(-3));
    }

    @Test
    void testSlotsPerShardForHugeCapacity() {
        CacheOptions options = CacheOptions.builder()
                .maxEntries(Integer.MAX_VALUE)
                .shardCount(16)
                .build();
        assertEquals(134_217_728, options.getSlotsPerShard());

        CacheOptions nearMax = CacheOptions.builder()
                .maxEntries(Integer.MAX_VALUE - 1)
                .shardCount(2)
                .build();
        assertEquals(1_073_741_823, nearMax.getSlotsPerShard());
    }

    @Test
    void testRingTooLargeForSingleShard() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> CacheOptions.builder().maxEntries(Integer.MAX_VALUE).shardCount(1).build());
        assertTrue(e.getMessage().contains("slots per shard"));
    }

    @Test
    void testToString() {
        String str = CacheOptions.builder().maxEntries(100).shardCount(4).build().toString();
        assertTrue(str.contains("maxEntries=100"));
        assertTrue(str.contains("shardCount=4"));
        assertTrue(str.contains("slotsPerShard=25"));
    }
}
