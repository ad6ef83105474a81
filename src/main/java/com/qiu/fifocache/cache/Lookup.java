package com.qiu.fifocache.cache;

import java.util.Objects;
import java.util.Optional;

/**
 * 复合操作的结果：值以及该值是否来自缓存中已有的条目
 *
 * <p>{@code getOrSet} 命中时 loaded=true，返回已有值；未命中时 loaded=false，返回刚写入的值。
 * {@code getAndDelete} 命中时 loaded=true，返回被删除的值；未命中时值为 null。
 */
public final class Lookup<V> {
    private static final Lookup<?> MISS = new Lookup<>(null, false);

    private final V value;
    private final boolean loaded;

    private Lookup(V value, boolean loaded) {
        this.value = value;
        this.loaded = loaded;
    }

    static <V> Lookup<V> loaded(V value) {
        return new Lookup<>(value, true);
    }

    static <V> Lookup<V> stored(V value) {
        return new Lookup<>(value, false);
    }

    @SuppressWarnings("unchecked")
    static <V> Lookup<V> miss() {
        return (Lookup<V>) MISS;
    }

    public V getValue() {
        return value;
    }

    public boolean isLoaded() {
        return loaded;
    }

    public Optional<V> toOptional() {
        return Optional.ofNullable(value);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Lookup<?> that = (Lookup<?>) obj;
        return loaded == that.loaded && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, loaded);
    }

    @Override
    public String toString() {
        return String.format("Lookup{value=%s, loaded=%b}", value, loaded);
    }
}
