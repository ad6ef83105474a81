package com.qiu.fifocache.cache;

import com.qiu.fifocache.core.CacheOptions;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiPredicate;
import java.util.function.Function;

/**
 * 分片FIFO缓存，将缓存分成多个分片以减少锁竞争
 *
 * <p>容量按条目数计算，由所有分片共享的全局计数控制；达到容量后插入新键会淘汰
 * 本分片中最早插入的键。读操作不影响淘汰顺序。
 *
 * <p>没有缓存级别的全局锁：写操作只持有一个分片的写锁，读操作持有读锁。
 * 并发写入不同分片时，总条目数可能短暂超出容量（每个并发分片最多一个）。
 */
public class ShardedCache<K, V> implements Cache<K, V> {
    private final int numShards;
    private final Shard<K, V>[] shards;
    private final KeyRouter router;
    private final int capacity;
    private final AtomicLong liveCount;

    public ShardedCache(int maxEntries) {
        this(CacheOptions.withMaxEntries(maxEntries));
    }

    public ShardedCache(int maxEntries, int numShards) {
        this(CacheOptions.builder().maxEntries(maxEntries).shardCount(numShards).build());
    }

    @SuppressWarnings("unchecked")
    public ShardedCache(CacheOptions options) {
        Objects.requireNonNull(options, "Options cannot be null");

        this.capacity = options.getMaxEntries();
        this.numShards = options.getShardCount();
        this.router = new KeyRouter(numShards);
        this.liveCount = new AtomicLong(0);
        this.shards = (Shard<K, V>[]) new Shard[numShards];

        int slotsPerShard = options.getSlotsPerShard();
        for (int i = 0; i < numShards; i++) {
            shards[i] = new Shard<>(i, slotsPerShard, capacity, liveCount);
        }
    }

    /**
     * 根据键计算分片索引
     */
    int getShardIndex(K key) {
        return router.route(key);
    }

    /**
     * 获取指定键所在的分片
     */
    private Shard<K, V> getShard(K key) {
        return shards[router.route(key)];
    }

    @Override
    public void set(K key, V value) {
        Objects.requireNonNull(key, "Key cannot be null");
        Objects.requireNonNull(value, "Value cannot be null");
        getShard(key).set(key, value);
    }

    @Override
    public V get(K key) {
        Objects.requireNonNull(key, "Key cannot be null");
        return getShard(key).get(key);
    }

    @Override
    public boolean has(K key) {
        return get(key) != null;
    }

    @Override
    public Lookup<V> getOrSet(K key, V value) {
        Objects.requireNonNull(key, "Key cannot be null");
        Objects.requireNonNull(value, "Value cannot be null");
        return getShard(key).getOrSet(key, value);
    }

    @Override
    public boolean setIfAbsent(K key, V value) {
        Objects.requireNonNull(key, "Key cannot be null");
        Objects.requireNonNull(value, "Value cannot be null");
        return getShard(key).setIfAbsent(key, value);
    }

    @Override
    public boolean delete(K key) {
        Objects.requireNonNull(key, "Key cannot be null");
        return getShard(key).delete(key);
    }

    @Override
    public Lookup<V> getAndDelete(K key) {
        Objects.requireNonNull(key, "Key cannot be null");
        return getShard(key).getAndDelete(key);
    }

    /**
     * 逐个分片重置，最后重置全局计数
     * 各分片分别加锁，与之并发的写入可能被随后的分片重置覆盖
     */
    @Override
    public void clear() {
        for (Shard<K, V> shard : shards) {
            shard.reset();
        }
        liveCount.set(0);
    }

    @Override
    public int size() {
        return (int) liveCount.get();
    }

    @Override
    public int getCapacity() {
        return capacity;
    }

    /**
     * 获取分片数量
     */
    public int getShardCount() {
        return numShards;
    }

    /**
     * 在读锁下拷贝指定分片的全部条目
     */
    public List<Map.Entry<K, V>> snapshotShard(int shardIndex) {
        checkShardIndex(shardIndex);
        return shards[shardIndex].snapshot();
    }

    /**
     * 获取指定分片中的条目数（用于监控）
     */
    public int shardSize(int shardIndex) {
        checkShardIndex(shardIndex);
        return shards[shardIndex].size();
    }

    /**
     * 获取指定分片的统计信息（拷贝）
     */
    public ShardStats getShardStats(int shardIndex) {
        checkShardIndex(shardIndex);
        return new ShardStats(shards[shardIndex].getStats());
    }

    private void checkShardIndex(int shardIndex) {
        if (shardIndex < 0 || shardIndex >= numShards) {
            throw new IllegalArgumentException("Invalid shard index: " + shardIndex);
        }
    }

    @Override
    public Iterator<Map.Entry<K, V>> iterator() {
        return new ShardSnapshotIterator<>(shards);
    }

    @Override
    public boolean forEach(BiPredicate<? super K, ? super V> action) {
        Objects.requireNonNull(action, "Action cannot be null");
        for (Shard<K, V> shard : shards) {
            for (Map.Entry<K, V> e : shard.snapshot()) {
                if (!action.test(e.getKey(), e.getValue())) {
                    return false;
                }
            }
        }
        return true;
    }

    @Override
    public Iterable<K> keys() {
        return () -> mapping(Map.Entry::getKey);
    }

    @Override
    public Iterable<V> values() {
        return () -> mapping(Map.Entry::getValue);
    }

    private <T> Iterator<T> mapping(Function<Map.Entry<K, V>, T> fn) {
        Iterator<Map.Entry<K, V>> it = iterator();
        return new Iterator<T>() {
            @Override
            public boolean hasNext() {
                return it.hasNext();
            }

            @Override
            public T next() {
                return fn.apply(it.next());
            }
        };
    }

    @Override
    public void updateStats(CacheStats stats) {
        Objects.requireNonNull(stats, "Stats cannot be null");
        for (Shard<K, V> shard : shards) {
            shard.getStats().addTo(stats);
        }
        stats.complete(liveCount.get(), capacity);
    }

    /**
     * 获取一份新的统计快照
     */
    public CacheStats getStats() {
        CacheStats stats = new CacheStats();
        updateStats(stats);
        return stats;
    }

    @Override
    public String toString() {
        return String.format("ShardedCache{shards=%d, capacity=%d, entries=%d}",
                numShards, capacity, size());
    }
}
