package com.qiu.fifocache.snapshot;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.io.InvalidClassException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serializable;
import java.io.StreamCorruptedException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * 常用类型的编解码器
 */
public final class Codecs {
    /** 单个变长字段的上限，超过即视为数据损坏 */
    static final int MAX_FIELD_LENGTH = 256 * 1024 * 1024;

    private Codecs() {} // 防止实例化

    public static final Codec<String> STRING = new Codec<>() {
        @Override
        public void encode(String value, DataOutput out) throws IOException {
            writeBytes(value.getBytes(StandardCharsets.UTF_8), out);
        }

        @Override
        public String decode(DataInput in) throws IOException {
            return new String(readBytes(in), StandardCharsets.UTF_8);
        }
    };

    public static final Codec<Integer> INTEGER = new Codec<>() {
        @Override
        public void encode(Integer value, DataOutput out) throws IOException {
            out.writeInt(value);
        }

        @Override
        public Integer decode(DataInput in) throws IOException {
            return in.readInt();
        }
    };

    public static final Codec<Long> LONG = new Codec<>() {
        @Override
        public void encode(Long value, DataOutput out) throws IOException {
            out.writeLong(value);
        }

        @Override
        public Long decode(DataInput in) throws IOException {
            return in.readLong();
        }
    };

    public static final Codec<byte[]> BYTES = new Codec<>() {
        @Override
        public void encode(byte[] value, DataOutput out) throws IOException {
            writeBytes(value, out);
        }

        @Override
        public byte[] decode(DataInput in) throws IOException {
            return readBytes(in);
        }
    };

    /**
     * 基于Java序列化的通用编解码器，适用于任意 {@link Serializable} 结构
     * 解码出的对象类型与 type 不符时视为数据损坏
     */
    public static <T extends Serializable> Codec<T> serializable(Class<T> type) {
        Objects.requireNonNull(type, "Type cannot be null");
        return new Codec<>() {
            @Override
            public void encode(T value, DataOutput out) throws IOException {
                ByteArrayOutputStream baos = new ByteArrayOutputStream();
                try (ObjectOutputStream oos = new ObjectOutputStream(baos)) {
                    oos.writeObject(value);
                }
                writeBytes(baos.toByteArray(), out);
            }

            @Override
            public T decode(DataInput in) throws IOException {
                byte[] data = readBytes(in);
                try (ObjectInputStream ois = new ObjectInputStream(new ByteArrayInputStream(data))) {
                    Object obj = ois.readObject();
                    if (!type.isInstance(obj)) {
                        throw new CorruptSnapshotException("Expected " + type.getName() + " but decoded "
                                + (obj == null ? "null" : obj.getClass().getName()));
                    }
                    return type.cast(obj);
                } catch (ClassNotFoundException | InvalidClassException | StreamCorruptedException e) {
                    throw new CorruptSnapshotException("Cannot deserialize " + type.getName(), e);
                }
            }
        };
    }

    static void writeBytes(byte[] data, DataOutput out) throws IOException {
        out.writeInt(data.length);
        out.write(data);
    }

    static byte[] readBytes(DataInput in) throws IOException {
        int length = in.readInt();
        if (length < 0 || length > MAX_FIELD_LENGTH) {
            throw new CorruptSnapshotException("Invalid field length: " + length);
        }
        byte[] data = new byte[length];
        in.readFully(data);
        return data;
    }
}
