package com.qiu.fifocache.core;

/**
 * 缓存配置选项
 */
public class CacheOptions {
    public static final int DEFAULT_MAX_ENTRIES = 1024;
    public static final int DEFAULT_SHARD_COUNT = 16;
    /** 单个分片环形缓冲区的最大槽位数（数组长度上限） */
    public static final int MAX_SLOTS_PER_SHARD = Integer.MAX_VALUE - 8;

    private final int maxEntries;
    private final int shardCount;

    private CacheOptions(Builder builder) {
        this.maxEntries = builder.maxEntries;
        this.shardCount = builder.shardCount;
    }

    // Getters
    public int getMaxEntries() { return maxEntries; }
    public int getShardCount() { return shardCount; }

    /**
     * 每个分片环形缓冲区的槽位数（向上取整）
     */
    public int getSlotsPerShard() {
        return slotsPerShard(maxEntries, shardCount);
    }

    private static int slotsPerShard(int maxEntries, int shardCount) {
        return (int) (((long) maxEntries + shardCount - 1) / shardCount);
    }

    /**
     * Builder模式创建配置
     */
    public static class Builder {
        private int maxEntries = DEFAULT_MAX_ENTRIES;
        private int shardCount = DEFAULT_SHARD_COUNT;

        public Builder maxEntries(int maxEntries) {
            if (maxEntries <= 0) {
                throw new IllegalArgumentException("maxEntries must be greater than 0; got " + maxEntries);
            }
            this.maxEntries = maxEntries;
            return this;
        }

        public Builder shardCount(int shardCount) {
            if (shardCount <= 0) throw new IllegalArgumentException("Number of shards must be positive");
            this.shardCount = shardCount;
            return this;
        }

        public CacheOptions build() {
            int slots = slotsPerShard(maxEntries, shardCount);
            if (slots > MAX_SLOTS_PER_SHARD) {
                throw new IllegalArgumentException(String.format(
                        "maxEntries=%d with %d shards needs %d slots per shard; at most %d allowed, use more shards",
                        maxEntries, shardCount, slots, MAX_SLOTS_PER_SHARD));
            }
            return new CacheOptions(this);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static CacheOptions defaultOptions() {
        return new Builder().build();
    }

    public static CacheOptions withMaxEntries(int maxEntries) {
        return new Builder().maxEntries(maxEntries).build();
    }

    @Override
    public String toString() {
        return String.format("CacheOptions{maxEntries=%d, shardCount=%d, slotsPerShard=%d}",
                maxEntries, shardCount, getSlotsPerShard());
    }
}
