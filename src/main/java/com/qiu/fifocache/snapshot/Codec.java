package com.qiu.fifocache.snapshot;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;

/**
 * 键或值的二进制编解码器
 *
 * <p>实现必须满足 decode(encode(x)).equals(x)，并且编码结果是自定界的（解码时不依赖外部长度）。
 */
public interface Codec<T> {
    void encode(T value, DataOutput out) throws IOException;

    T decode(DataInput in) throws IOException;
}
