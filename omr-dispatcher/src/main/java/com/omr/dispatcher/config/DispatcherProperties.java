package com.omr.dispatcher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 批量调度配置项。
 */
@Data
@ConfigurationProperties(prefix = "omr.dispatcher")
public class DispatcherProperties {

    /** 批次计数的存储类型: memory（内存，单机） / redis（多实例共享） */
    private String storageType = "memory";

    /** 并发处理文件的工作线程数，1 表示顺序执行 */
    private int workerCount = 4;

    /** 工作线程数上限，超出时按上限执行 */
    private int maxWorkers = 16;

    /** 每完成多少个文件打印一次进度 */
    private int progressLogInterval = 5;

    /** 批次计数在 Redis 中的 hash key 前缀，实际 key 为 前缀:批次ID */
    private String counterKeyName = "omr:batch:counters";

    /** 批次计数 hash 的过期时间 */
    private Duration counterTtl = Duration.ofHours(24);
}
