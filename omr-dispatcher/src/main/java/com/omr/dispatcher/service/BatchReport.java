package com.omr.dispatcher.service;

import com.omr.common.dto.FileResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 一次批量运行的汇总。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchReport {

    private String batchId;

    /** 按 inputIndex 排列的全部结果（含失败占位） */
    @Builder.Default
    private List<FileResult> results = new ArrayList<>();

    private int succeeded;

    private int failed;

    /** 实际使用的工作线程数 */
    private int workerCount;

    /** 是否执行了重排（顺序模式下为 false） */
    private boolean reordered;

    /** 经历的调度阶段 */
    @Builder.Default
    private List<SchedulerState> stateTrail = new ArrayList<>();

    /** 批次计数快照 */
    private Map<String, Long> counters;

    private long elapsedMs;

    public List<FileResult> failedResults() {
        return results.stream().filter(r -> !r.isSuccess()).toList();
    }
}
