package com.qiu.fifocache.cache;

/**
 * 缓存统计信息（调用方持有的累加器）
 *
 * <p>由 {@link ShardedCache#updateStats(CacheStats)} 填充。计数会累加而不会自动清零，
 * 复用同一对象前需调用 {@link #reset()}。各分片分别读取，结果不是跨分片的原子快照，
 * 只适合监控用途。
 */
public class CacheStats {
    private long getCalls;
    private long setCalls;
    private long misses;
    private long hits;
    private long deletes;
    private long evictions;
    private long entriesCount;
    private long maxEntries;

    public CacheStats() {
    }

    public CacheStats(CacheStats other) {
        this.getCalls = other.getCalls;
        this.setCalls = other.setCalls;
        this.misses = other.misses;
        this.hits = other.hits;
        this.deletes = other.deletes;
        this.evictions = other.evictions;
        this.entriesCount = other.entriesCount;
        this.maxEntries = other.maxEntries;
    }

    void add(long getCalls, long setCalls, long misses, long deletes, long evictions) {
        this.getCalls += getCalls;
        this.setCalls += setCalls;
        this.misses += misses;
        this.deletes += deletes;
        this.evictions += evictions;
    }

    /**
     * 汇总完成后写入全局字段
     */
    void complete(long entriesCount, long maxEntries) {
        this.entriesCount = entriesCount;
        this.maxEntries = maxEntries;
        this.hits = getCalls - misses;
    }

    public long getGetCalls() {
        return getCalls;
    }

    public long getSetCalls() {
        return setCalls;
    }

    public long getMisses() {
        return misses;
    }

    public long getHits() {
        return hits;
    }

    public long getDeletes() {
        return deletes;
    }

    public long getEvictions() {
        return evictions;
    }

    public long getEntriesCount() {
        return entriesCount;
    }

    public long getMaxEntries() {
        return maxEntries;
    }

    public double getHitRate() {
        return getCalls > 0 ? (double) hits / getCalls : 0.0;
    }

    public double getMissRate() {
        return getCalls > 0 ? (double) misses / getCalls : 0.0;
    }

    public void reset() {
        getCalls = 0;
        setCalls = 0;
        misses = 0;
        hits = 0;
        deletes = 0;
        evictions = 0;
        entriesCount = 0;
        maxEntries = 0;
    }

    @Override
    public String toString() {
        return String.format("CacheStats{gets=%d, sets=%d, hits=%d, misses=%d, hitRate=%.3f, deletes=%d, evictions=%d, entries=%d/%d}",
                getCalls, setCalls, hits, misses, getHitRate(), deletes, evictions, entriesCount, maxEntries);
    }
}
