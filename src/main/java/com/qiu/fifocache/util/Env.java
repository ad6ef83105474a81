package com.qiu.fifocache.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * 环境相关的文件操作工具
 */
public class Env {
    private Env() {} // 防止实例化

    /**
     * 创建目录（含父目录），已存在时不做任何事
     */
    public static void createDir(Path dir) throws IOException {
        if (dir != null && !Files.isDirectory(dir)) {
            Files.createDirectories(dir);
        }
    }

    /**
     * 在目标文件所在目录创建临时文件，保证随后的重命名不跨文件系统
     */
    public static Path createTempFileBeside(Path target, String prefix) throws IOException {
        Path dir = parentOf(target);
        createDir(dir);
        return Files.createTempFile(dir, prefix, null);
    }

    public static boolean deleteFile(Path path) throws IOException {
        return Files.deleteIfExists(path);
    }

    /**
     * 原子重命名，覆盖已存在的目标文件
     */
    public static void renameFile(Path source, Path target) throws IOException {
        Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }

    static Path parentOf(Path target) {
        Path parent = target.toAbsolutePath().getParent();
        if (parent == null) {
            throw new IllegalArgumentException("Path has no parent directory: " + target);
        }
        return parent;
    }
}
