package com.qiu.fifocache.cache;

/**
 * 固定容量的环形缓冲区，按插入顺序记录一个分片的键（FIFO淘汰顺序）
 *
 * <p>槽位原地复用，不做压缩；删除留下的失效槽位在写游标再次经过时才被回收。
 * 非线程安全，由所属分片的写锁保护。
 */
final class EvictionRing<K> {
    private final KeySlot<K>[] slots;
    private int writeCursor;

    @SuppressWarnings("unchecked")
    EvictionRing(int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("Ring length must be positive");
        }
        this.slots = (KeySlot<K>[]) new KeySlot[length];
        for (int i = 0; i < length; i++) {
            slots[i] = new KeySlot<>();
        }
        this.writeCursor = 0;
    }

    int length() {
        return slots.length;
    }

    int cursor() {
        return writeCursor;
    }

    /**
     * 当前写游标处的槽位
     */
    KeySlot<K> current() {
        return slots[writeCursor];
    }

    void advance() {
        writeCursor = (writeCursor + 1) % slots.length;
    }

    /**
     * 在游标处写入新键（覆盖原有内容）并前移游标
     */
    void record(K key) {
        slots[writeCursor].occupy(key);
        advance();
    }

    /**
     * 写入刚被淘汰循环腾出的槽位（游标前一格），游标不动
     * 新键由此排在所有未淘汰键之后
     */
    void refill(K key) {
        slots[(writeCursor + slots.length - 1) % slots.length].occupy(key);
    }

    /**
     * 所有槽位置为空，游标归零
     */
    void reset() {
        for (KeySlot<K> slot : slots) {
            slot.vacate();
        }
        writeCursor = 0;
    }

    int occupiedCount() {
        int count = 0;
        for (KeySlot<K> slot : slots) {
            if (slot.isOccupied()) {
                count++;
            }
        }
        return count;
    }

    @Override
    public String toString() {
        return String.format("EvictionRing{length=%d, cursor=%d, occupied=%d}",
                slots.length, writeCursor, occupiedCount());
    }
}
