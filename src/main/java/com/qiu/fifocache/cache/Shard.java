package com.qiu.fifocache.cache;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 缓存分片：一个键值表 + 一个FIFO淘汰环 + 一把读写锁
 *
 * <p>容量判断以所有分片共享的全局条目计数为准，淘汰只在本分片的环内进行。
 * 全局计数在分片锁之外原子更新，并发写入不同分片时总条目数可能短暂超出容量。
 */
final class Shard<K, V> {
    private final int index;
    private final long capacity;
    private final AtomicLong liveCount;
    private final int initialMapCapacity;
    private Map<K, V> entries;
    private final EvictionRing<K> ring;
    private final ReadWriteLock lock;
    private final ShardStats stats;

    Shard(int index, int slots, long capacity, AtomicLong liveCount) {
        this.index = index;
        this.capacity = capacity;
        this.liveCount = liveCount;
        this.initialMapCapacity = slots;
        this.entries = new HashMap<>(slots);
        this.ring = new EvictionRing<>(slots);
        this.lock = new ReentrantReadWriteLock();
        this.stats = new ShardStats();
    }

    V get(K key) {
        Lock readLock = lock.readLock();
        readLock.lock();
        V value;
        try {
            stats.recordGet();
            value = entries.get(key);
        } finally {
            readLock.unlock();
        }
        if (value == null) {
            stats.recordMiss();
        }
        return value;
    }

    void set(K key, V value) {
        stats.recordSet();

        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            // 已存在的键原地更新，不算新插入
            if (entries.containsKey(key)) {
                entries.put(key, value);
                return;
            }
            insertNew(key, value);
        } finally {
            writeLock.unlock();
        }
    }

    Lookup<V> getOrSet(K key, V value) {
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            V existing = entries.get(key);
            if (existing != null) {
                stats.recordGet();
                return Lookup.loaded(existing);
            }

            stats.recordSet();
            insertNew(key, value);
            return Lookup.stored(value);
        } finally {
            writeLock.unlock();
        }
    }

    boolean setIfAbsent(K key, V value) {
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            if (entries.containsKey(key)) {
                return false;
            }

            stats.recordSet();
            insertNew(key, value);
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * 删除键。环中对应槽位保持不变，等写游标再次经过时再回收
     */
    boolean delete(K key) {
        stats.recordDelete();

        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            return removeInternal(key) != null;
        } finally {
            writeLock.unlock();
        }
    }

    Lookup<V> getAndDelete(K key) {
        stats.recordDelete();

        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            V removed = removeInternal(key);
            return removed != null ? Lookup.loaded(removed) : Lookup.miss();
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * 内部删除方法（假设已经持有写锁）
     */
    private V removeInternal(K key) {
        V removed = entries.remove(key);
        if (removed != null) {
            liveCount.decrementAndGet();
        }
        return removed;
    }

    /**
     * 插入新键（假设已经持有写锁且键不存在）
     *
     * <p>全局计数达到容量时沿环淘汰，最多走一圈。压力来自其他分片时可能一个也淘汰不了，
     * 此时照常插入。淘汰循环执行过时，新键写入最后腾出的槽位；否则写入游标处，
     * 覆盖的若是仍存活的键，该键不再被环跟踪（分片条目数超过槽位数时发生）。
     */
    private void insertNew(K key, V value) {
        boolean freed = false;
        int maxIter = ring.length();
        for (int i = 0; i < maxIter && liveCount.get() >= capacity && !entries.isEmpty(); i++) {
            KeySlot<K> slot = ring.current();
            if (slot.isOccupied()) {
                if (entries.remove(slot.getKey()) != null) {
                    liveCount.decrementAndGet();
                    stats.recordEviction();
                }
                // 已被删除的键：计数在删除时已经减过
                slot.vacate();
            }
            ring.advance();
            freed = true;
        }

        if (freed) {
            ring.refill(key);
        } else {
            ring.record(key);
        }
        entries.put(key, value);
        liveCount.incrementAndGet();
    }

    /**
     * 重置分片：新的空表，环全部清空，计数归零
     */
    void reset() {
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            entries = new HashMap<>(initialMapCapacity);
            ring.reset();
            stats.reset();
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * 在读锁下拷贝当前全部条目
     */
    List<Map.Entry<K, V>> snapshot() {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            List<Map.Entry<K, V>> copy = new ArrayList<>(entries.size());
            for (Map.Entry<K, V> e : entries.entrySet()) {
                copy.add(new AbstractMap.SimpleImmutableEntry<>(e.getKey(), e.getValue()));
            }
            return copy;
        } finally {
            readLock.unlock();
        }
    }

    int size() {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return entries.size();
        } finally {
            readLock.unlock();
        }
    }

    ShardStats getStats() {
        return stats;
    }

    @Override
    public String toString() {
        return String.format("Shard{index=%d, entries=%d, ring=%s, stats=%s}",
                index, size(), ring, stats);
    }
}
