package com.qiu.fifocache.cache;

import java.util.concurrent.ThreadLocalRandom;

/**
 * 键路由：将任意键映射到分片索引
 *
 * <p>基于 {@link Object#hashCode()}，与进程级随机种子混合后经过 64 位 finalizer 打散，
 * 同一进程内结果确定，不同进程间不同。
 */
final class KeyRouter {
    private static final long SEED = ThreadLocalRandom.current().nextLong();

    private final int shardCount;

    KeyRouter(int shardCount) {
        if (shardCount <= 0) {
            throw new IllegalArgumentException("Number of shards must be positive");
        }
        this.shardCount = shardCount;
    }

    int shardCount() {
        return shardCount;
    }

    /**
     * 根据键计算分片索引（确保非负）
     */
    int route(Object key) {
        return (int) Long.remainderUnsigned(hash(key), shardCount);
    }

    static long hash(Object key) {
        long h = (key.hashCode() * 0x9E3779B97F4A7C15L) ^ SEED;
        // murmur3 fmix64
        h ^= h >>> 33;
        h *= 0xFF51AFD7ED558CCDL;
        h ^= h >>> 33;
        h *= 0xC4CEB9FE1A85EC53L;
        h ^= h >>> 33;
        return h;
    }
}
