package com.qiu.fifocache.cache;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 分片级别的操作计数器
 * 读操作在读锁下计数，因此使用原子变量
 */
public class ShardStats {
    private final AtomicLong getCalls;
    private final AtomicLong setCalls;
    private final AtomicLong misses;
    private final AtomicLong deletes;
    private final AtomicLong evictions;

    public ShardStats() {
        this.getCalls = new AtomicLong(0);
        this.setCalls = new AtomicLong(0);
        this.misses = new AtomicLong(0);
        this.deletes = new AtomicLong(0);
        this.evictions = new AtomicLong(0);
    }

    public ShardStats(ShardStats other) {
        this.getCalls = new AtomicLong(other.getCalls.get());
        this.setCalls = new AtomicLong(other.setCalls.get());
        this.misses = new AtomicLong(other.misses.get());
        this.deletes = new AtomicLong(other.deletes.get());
        this.evictions = new AtomicLong(other.evictions.get());
    }

    public void recordGet() {
        getCalls.incrementAndGet();
    }

    public void recordSet() {
        setCalls.incrementAndGet();
    }

    public void recordMiss() {
        misses.incrementAndGet();
    }

    public void recordDelete() {
        deletes.incrementAndGet();
    }

    public void recordEviction() {
        evictions.incrementAndGet();
    }

    public long getGetCalls() {
        return getCalls.get();
    }

    public long getSetCalls() {
        return setCalls.get();
    }

    public long getMisses() {
        return misses.get();
    }

    public long getDeletes() {
        return deletes.get();
    }

    public long getEvictions() {
        return evictions.get();
    }

    public void reset() {
        getCalls.set(0);
        setCalls.set(0);
        misses.set(0);
        deletes.set(0);
        evictions.set(0);
    }

    /**
     * 将本分片计数累加到汇总对象
     */
    void addTo(CacheStats stats) {
        stats.add(getCalls.get(), setCalls.get(), misses.get(), deletes.get(), evictions.get());
    }

    @Override
    public String toString() {
        return String.format("ShardStats{gets=%d, sets=%d, misses=%d, deletes=%d, evictions=%d}",
                getCalls.get(), setCalls.get(), misses.get(), deletes.get(), evictions.get());
    }
}
