package com.qiu.fifocache.cache;

/**
 * 环形缓冲区中的一个插入位置
 * occupied=false 表示已被淘汰或重置；被删除的键在游标再次经过前仍保持 occupied
 */
final class KeySlot<K> {
    private K key;
    private boolean occupied;

    void occupy(K key) {
        this.key = key;
        this.occupied = true;
    }

    void vacate() {
        this.key = null;
        this.occupied = false;
    }

    K getKey() {
        return key;
    }

    boolean isOccupied() {
        return occupied;
    }

    @Override
    public String toString() {
        return occupied ? "KeySlot{key=" + key + "}" : "KeySlot{vacant}";
    }
}
