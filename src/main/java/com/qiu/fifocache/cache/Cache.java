package com.qiu.fifocache.cache;

import java.util.Map;
import java.util.Optional;
import java.util.function.BiPredicate;

/**
 * 缓存接口
 */
public interface Cache<K, V> extends Iterable<Map.Entry<K, V>> {
    /**
     * 写入缓存，已存在的键原地更新
     */
    void set(K key, V value);

    /**
     * 查找缓存数据，不存在时返回 null
     */
    V get(K key);

    /**
     * 查找缓存数据
     */
    default Optional<V> getIfPresent(K key) {
        return Optional.ofNullable(get(key));
    }

    /**
     * 判断键是否存在
     */
    boolean has(K key);

    /**
     * 键存在时返回已有值，否则写入给定值
     */
    Lookup<V> getOrSet(K key, V value);

    /**
     * 仅在键不存在时写入
     */
    boolean setIfAbsent(K key, V value);

    /**
     * 删除缓存数据
     */
    boolean delete(K key);

    /**
     * 删除并返回缓存数据
     */
    Lookup<V> getAndDelete(K key);

    /**
     * 清空缓存
     */
    void clear();

    /**
     * 获取缓存条目数量
     */
    int size();

    /**
     * 获取缓存容量（条目数）
     */
    int getCapacity();

    /**
     * 逐个分片遍历，返回 false 时提前结束
     */
    boolean forEach(BiPredicate<? super K, ? super V> action);

    Iterable<K> keys();

    Iterable<V> values();

    /**
     * 将统计数据累加到给定对象
     */
    void updateStats(CacheStats stats);
}
