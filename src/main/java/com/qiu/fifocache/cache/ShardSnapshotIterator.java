package com.qiu.fifocache.cache;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * 按分片惰性拷贝的快照迭代器
 *
 * <p>只有在上一个分片的条目被消费完后才会去拷贝下一个分片，调用方停止迭代即不再访问后续分片。
 * 每个分片内部一致，整个缓存范围内不是原子快照。
 */
final class ShardSnapshotIterator<K, V> implements Iterator<Map.Entry<K, V>> {
    private final Shard<K, V>[] shards;
    private int nextShard;
    private Iterator<Map.Entry<K, V>> current;

    ShardSnapshotIterator(Shard<K, V>[] shards) {
        this.shards = shards;
        this.nextShard = 0;
        this.current = Collections.emptyIterator();
    }

    @Override
    public boolean hasNext() {
        while (!current.hasNext()) {
            if (nextShard >= shards.length) {
                return false;
            }
            List<Map.Entry<K, V>> copy = shards[nextShard++].snapshot();
            current = copy.iterator();
        }
        return true;
    }

    @Override
    public Map.Entry<K, V> next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return current.next();
    }

    /**
     * 已拷贝过的分片数量
     */
    int visitedShards() {
        return nextShard;
    }
}
