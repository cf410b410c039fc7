package com.omr.common.util;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * 批次标识生成。
 */
public final class IdGenerator {

    private static final DateTimeFormatter BATCH_TIME = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private IdGenerator() {
    }

    /**
     * 批次 ID，如 "batch-20240315-093012-1f3a9c"。时间在前，日志和输出目录按名称排序即按时间排序。
     */
    public static String batchId() {
        return "batch-" + LocalDateTime.now().format(BATCH_TIME) + "-" + randomSuffix(6);
    }

    /**
     * 随机十六进制后缀，长度 1-32。
     */
    public static String randomSuffix(int length) {
        if (length < 1 || length > 32) {
            throw new IllegalArgumentException("后缀长度必须在 1-32 之间: " + length);
        }
        return UUID.randomUUID().toString().replace("-", "").substring(0, length);
    }
}
