package com.qiu.fifocache.snapshot;

import com.qiu.fifocache.cache.ShardedCache;
import com.qiu.fifocache.core.CacheOptions;
import com.qiu.fifocache.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.zip.ZipException;

/**
 * 缓存快照的保存与加载
 *
 * <p>流格式（压缩后）：
 * <pre>
 *   capacity:int32 | totalEntries:int32 | totalEntries x (key, value)
 * </pre>
 * 条目按分片序号排列，分片内顺序任意（不是插入顺序）。保存过程中每个分片只在拷贝时持有读锁，
 * 其他线程可以同时读写缓存，因此快照按分片一致，但不是整个缓存的原子快照。
 *
 * <p>加载时按顺序逐条 set，会触发正常的淘汰逻辑：保存时条目数超过目标容量的快照，加载后条目更少。
 */
public class SnapshotCodec<K, V> {
    private static final Logger LOG = LoggerFactory.getLogger(SnapshotCodec.class);

    static final String TEMP_FILE_PREFIX = "fifocache.tmp.";

    private final Codec<K> keyCodec;
    private final Codec<V> valueCodec;
    private final StreamCompressor compressor;
    private final int shardCount;

    private SnapshotCodec(Builder<K, V> builder) {
        this.keyCodec = builder.keyCodec;
        this.valueCodec = builder.valueCodec;
        this.compressor = builder.compressor;
        this.shardCount = builder.shardCount;
    }

    public static <K, V> SnapshotCodec<K, V> of(Codec<K> keyCodec, Codec<V> valueCodec) {
        return builder(keyCodec, valueCodec).build();
    }

    public static <K, V> Builder<K, V> builder(Codec<K> keyCodec, Codec<V> valueCodec) {
        return new Builder<>(keyCodec, valueCodec);
    }

    /**
     * 原子地将缓存保存到文件（单个工作线程）
     */
    public void saveToFile(ShardedCache<K, V> cache, Path filePath) throws IOException {
        saveToFileConcurrent(cache, filePath, 1);
    }

    /**
     * 原子地将缓存保存到文件
     *
     * <p>先写入同目录下的临时文件，成功后重命名覆盖目标文件；任何失败都会删除临时文件，
     * 目标文件保持原样。父目录不存在时自动创建。
     *
     * @param concurrency 拷贝分片的工作线程数，&lt;=0 或超过可用处理器数时取可用处理器数
     */
    public void saveToFileConcurrent(ShardedCache<K, V> cache, Path filePath, int concurrency) throws IOException {
        Objects.requireNonNull(cache, "Cache cannot be null");
        Objects.requireNonNull(filePath, "File path cannot be null");

        Path target = filePath.toAbsolutePath();
        Path tmpPath = Env.createTempFileBeside(target, TEMP_FILE_PREFIX);
        boolean renamed = false;
        try {
            try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(tmpPath))) {
                save(cache, out, concurrency);
            }
            Env.renameFile(tmpPath, target);
            renamed = true;
            LOG.info("Saved cache snapshot to {} ({} entries)", target, cache.size());
        } finally {
            if (!renamed) {
                deleteTempFile(tmpPath);
            }
        }
    }

    private static void deleteTempFile(Path tmpPath) {
        try {
            Env.deleteFile(tmpPath);
        } catch (IOException e) {
            LOG.warn("Cannot remove temporary snapshot file {}", tmpPath, e);
        }
    }

    /**
     * 将缓存保存到输出流（单个工作线程），不关闭输出流
     */
    public void saveTo(ShardedCache<K, V> cache, OutputStream sink) throws IOException {
        save(cache, sink, 1);
    }

    /**
     * 将缓存保存到输出流，不关闭输出流
     */
    public void saveTo(ShardedCache<K, V> cache, OutputStream sink, int concurrency) throws IOException {
        save(cache, sink, concurrency);
    }

    private void save(ShardedCache<K, V> cache, OutputStream sink, int concurrency) throws IOException {
        Objects.requireNonNull(cache, "Cache cannot be null");
        Objects.requireNonNull(sink, "Output stream cannot be null");

        long start = System.nanoTime();
        int workers = effectiveConcurrency(concurrency);

        // 关闭 dos 时压缩器写出尾部数据，但不关闭调用方的流
        try (DataOutputStream dos = new DataOutputStream(new BufferedOutputStream(
                compressor.compress(new UncloseableOutputStream(sink))))) {
            dos.writeInt(cache.getCapacity());

            List<List<Map.Entry<K, V>>> shardEntries = collectShards(cache, workers);

            int totalEntries = 0;
            for (List<Map.Entry<K, V>> entries : shardEntries) {
                totalEntries += entries.size();
            }
            dos.writeInt(totalEntries);

            for (List<Map.Entry<K, V>> entries : shardEntries) {
                for (Map.Entry<K, V> e : entries) {
                    keyCodec.encode(e.getKey(), dos);
                    valueCodec.encode(e.getValue(), dos);
                }
            }

            LOG.debug("Encoded {} entries from {} shards with {} workers in {} ms",
                    totalEntries, shardEntries.size(), workers, (System.nanoTime() - start) / 1_000_000);
        }
    }

    static int effectiveConcurrency(int requested) {
        int processors = Runtime.getRuntime().availableProcessors();
        if (requested <= 0 || requested > processors) {
            return processors;
        }
        return requested;
    }

    /**
     * 并发拷贝各分片，等待全部完成后按分片序号返回
     */
    private List<List<Map.Entry<K, V>>> collectShards(ShardedCache<K, V> cache, int workers) throws IOException {
        int shards = cache.getShardCount();
        List<List<Map.Entry<K, V>>> result = new ArrayList<>(shards);

        if (workers == 1) {
            for (int i = 0; i < shards; i++) {
                result.add(cache.snapshotShard(i));
            }
            return result;
        }

        ExecutorService pool = Executors.newFixedThreadPool(workers, new SnapshotThreadFactory());
        try {
            List<Future<ShardEntries<K, V>>> futures = new ArrayList<>(shards);
            for (int i = 0; i < shards; i++) {
                final int shardIndex = i;
                futures.add(pool.submit(() -> new ShardEntries<K, V>(shardIndex, cache.snapshotShard(shardIndex))));
            }

            @SuppressWarnings("unchecked")
            List<Map.Entry<K, V>>[] byIndex = (List<Map.Entry<K, V>>[]) new List[shards];
            for (Future<ShardEntries<K, V>> future : futures) {
                ShardEntries<K, V> data = future.get();
                byIndex[data.index] = data.entries;
            }
            for (List<Map.Entry<K, V>> entries : byIndex) {
                result.add(entries);
            }
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException ex = new InterruptedIOException("Interrupted while copying shards");
            ex.initCause(e);
            throw ex;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IOException("Cannot copy shard entries", cause);
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * 从文件加载缓存，文件不存在时抛出 {@link java.nio.file.NoSuchFileException}
     */
    public ShardedCache<K, V> loadFromFile(Path filePath) throws IOException {
        Objects.requireNonNull(filePath, "File path cannot be null");
        try (InputStream in = Files.newInputStream(filePath)) {
            ShardedCache<K, V> cache = loadFrom(in);
            LOG.info("Loaded cache snapshot from {} ({} entries)", filePath, cache.size());
            return cache;
        }
    }

    /**
     * 尝试从文件加载缓存，任何错误（文件不存在、数据损坏、类型不匹配）都回退为指定容量的空缓存
     */
    public ShardedCache<K, V> loadFromFileOrNew(Path filePath, int maxEntries) {
        try {
            return loadFromFile(filePath);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Cannot load cache snapshot from {}, creating an empty cache with maxEntries={}",
                    filePath, maxEntries, e);
            return newCache(maxEntries);
        }
    }

    /**
     * 从输入流加载缓存，不关闭输入流
     * 最后一个条目之后流必须结束，多余的数据或校验和不符都视为数据损坏
     */
    public ShardedCache<K, V> loadFrom(InputStream source) throws IOException {
        Objects.requireNonNull(source, "Input stream cannot be null");
        try {
            DataInputStream in = new DataInputStream(new BufferedInputStream(compressor.decompress(source)));

            int capacity = in.readInt();
            if (capacity <= 0) {
                throw new CorruptSnapshotException("Invalid capacity in snapshot header: " + capacity);
            }
            ShardedCache<K, V> cache = newCache(capacity);

            int totalEntries = in.readInt();
            if (totalEntries < 0) {
                throw new CorruptSnapshotException("Invalid entry count in snapshot header: " + totalEntries);
            }

            for (int i = 0; i < totalEntries; i++) {
                K key = decodeField(keyCodec, in, i);
                V value = decodeField(valueCodec, in, i);
                cache.set(key, value);
            }

            // 读到流末尾：GZIP/DEFLATE 在此校验尾部校验和
            if (in.read() != -1) {
                throw new CorruptSnapshotException("Trailing data after " + totalEntries + " entries");
            }
            return cache;
        } catch (EOFException e) {
            throw new CorruptSnapshotException("Truncated snapshot stream", e);
        } catch (ZipException e) {
            throw new CorruptSnapshotException("Cannot decompress snapshot stream", e);
        }
    }

    private static <T> T decodeField(Codec<T> codec, DataInputStream in, int entryIndex) throws IOException {
        T value;
        try {
            value = codec.decode(in);
        } catch (EOFException e) {
            throw new CorruptSnapshotException("Truncated snapshot stream at entry " + entryIndex, e);
        }
        if (value == null) {
            throw new CorruptSnapshotException("Decoded null at entry " + entryIndex);
        }
        return value;
    }

    private ShardedCache<K, V> newCache(int maxEntries) {
        return new ShardedCache<>(CacheOptions.builder()
                .maxEntries(maxEntries)
                .shardCount(shardCount)
                .build());
    }

    public StreamCompressor getCompressor() {
        return compressor;
    }

    public int getShardCount() {
        return shardCount;
    }

    private static final class ShardEntries<K, V> {
        private final int index;
        private final List<Map.Entry<K, V>> entries;

        ShardEntries(int index, List<Map.Entry<K, V>> entries) {
            this.index = index;
            this.entries = entries;
        }
    }

    /**
     * 关闭时只刷新、不关闭底层流
     */
    private static final class UncloseableOutputStream extends FilterOutputStream {
        UncloseableOutputStream(OutputStream out) {
            super(out);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            out.write(b, off, len);
        }

        @Override
        public void close() throws IOException {
            flush();
        }
    }

    private static final class SnapshotThreadFactory implements ThreadFactory {
        private static final AtomicInteger POOL_SEQ = new AtomicInteger(0);
        private final int poolId = POOL_SEQ.incrementAndGet();
        private final AtomicInteger threadSeq = new AtomicInteger(0);

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "Snapshot-" + poolId + "-Worker-" + threadSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }

    /**
     * Builder模式创建编解码器
     */
    public static class Builder<K, V> {
        private final Codec<K> keyCodec;
        private final Codec<V> valueCodec;
        private StreamCompressor compressor = Compression.GZIP;
        private int shardCount = CacheOptions.DEFAULT_SHARD_COUNT;

        private Builder(Codec<K> keyCodec, Codec<V> valueCodec) {
            this.keyCodec = Objects.requireNonNull(keyCodec, "Key codec cannot be null");
            this.valueCodec = Objects.requireNonNull(valueCodec, "Value codec cannot be null");
        }

        public Builder<K, V> compression(StreamCompressor compressor) {
            this.compressor = Objects.requireNonNull(compressor, "Compressor cannot be null");
            return this;
        }

        /**
         * 加载时新建缓存使用的分片数
         */
        public Builder<K, V> shardCount(int shardCount) {
            if (shardCount <= 0) throw new IllegalArgumentException("Number of shards must be positive");
            this.shardCount = shardCount;
            return this;
        }

        public SnapshotCodec<K, V> build() {
            return new SnapshotCodec<>(this);
        }
    }
}
