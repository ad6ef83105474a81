package com.qiu.fifocache.snapshot;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * 快照流压缩器
 *
 * <p>{@link #compress(OutputStream)} 返回的流在 close() 时必须写出全部尾部数据。
 */
public interface StreamCompressor {
    OutputStream compress(OutputStream sink) throws IOException;

    InputStream decompress(InputStream source) throws IOException;
}
