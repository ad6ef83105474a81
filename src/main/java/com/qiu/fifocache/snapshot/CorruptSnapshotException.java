package com.qiu.fifocache.snapshot;

import java.io.IOException;

/**
 * 快照数据损坏：头部非法、数据截断、解压失败或键值类型不匹配
 */
public class CorruptSnapshotException extends IOException {
    public CorruptSnapshotException(String message) {
        super(message);
    }

    public CorruptSnapshotException(String message, Throwable cause) {
        super(message, cause);
    }
}
