package com.omr.dispatcher.counter;

import java.util.Map;

/**
 * 单个批次的计数：只保存计数，不保留任何样本，内存占用与批次大小无关。
 * 由 {@link BatchCounterStore#open(String)} 按批次创建，不在批次之间复用。
 * <p>
 * 提供两种实现：
 * - {@link InMemoryBatchCounters}：内存实现，适合单机部署
 * - {@link RedisBatchCounters}：每个批次一个 Redis hash，适合多实例部署
 * <p>
 * 所有实现都必须支持多个工作线程并发递增。
 */
public interface BatchCounters {

    String FILES_SUCCEEDED = "files.succeeded";
    String FILES_FAILED = "files.failed";
    String FILES_MULTI_MARKED = "files.multi_marked";
    String FIELD_TYPE_PREFIX = "fields.";

    /** 计数加一 */
    default void increment(String key) {
        incrementBy(key, 1);
    }

    /** 计数加 delta */
    void incrementBy(String key, long delta);

    /** 当前计数的只读快照 */
    Map<String, Long> snapshot();

    /** 单个计数，不存在时为 0 */
    default long get(String key) {
        return snapshot().getOrDefault(key, 0L);
    }

    /** 清空所有计数（批次开始时调用） */
    void reset();
}
