package com.qiu.fifocache.snapshot;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;
import java.util.zip.InflaterInputStream;

/**
 * 内置的压缩方式
 */
public enum Compression implements StreamCompressor {
    NONE {
        @Override
        public OutputStream compress(OutputStream sink) {
            return sink;
        }

        @Override
        public InputStream decompress(InputStream source) {
            return source;
        }
    },

    GZIP {
        @Override
        public OutputStream compress(OutputStream sink) throws IOException {
            return new GZIPOutputStream(sink, BUFFER_SIZE);
        }

        @Override
        public InputStream decompress(InputStream source) throws IOException {
            // 构造时即读取并校验GZIP头
            return new GZIPInputStream(source, BUFFER_SIZE);
        }
    },

    DEFLATE {
        @Override
        public OutputStream compress(OutputStream sink) {
            return new DeflaterOutputStream(sink);
        }

        @Override
        public InputStream decompress(InputStream source) {
            return new InflaterInputStream(source);
        }
    };

    private static final int BUFFER_SIZE = 64 * 1024;
}
