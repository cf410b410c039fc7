package com.omr.dispatcher.service;

import com.omr.common.dto.FileResult;
import com.omr.common.exception.BatchContractException;
import com.omr.common.util.IdGenerator;
import com.omr.dispatcher.config.DispatcherProperties;
import com.omr.dispatcher.counter.BatchCounterStore;
import com.omr.dispatcher.counter.BatchCounters;
import com.omr.dispatcher.counter.InMemoryBatchCounters;
import com.omr.dispatcher.sink.ResultSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 批量调度服务：用有界线程池并发处理一批答题卡，并按原始输入顺序输出结果。
 * <p>
 * 核心策略：
 * - 每个文件一个任务，任务之间不共享可变状态
 * - 结果按完成顺序收集，全部完成后按 inputIndex 排序再输出，排序前不输出任何结果
 * - 单个文件失败只产生失败占位，不中断批次
 * - workerCount == 1 时在调用线程中顺序执行，每个文件处理完立即输出，不做重排
 * - 每个批次从 {@link BatchCounterStore} 拿到独立的计数，多个批次可以同时运行
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchScheduler {

    private final BatchCounterStore counterStore;
    private final DispatcherProperties properties;

    /** 输出端临界区：每条结果进入一次 */
    private final ReentrantLock sinkLock = new ReentrantLock();

    /**
     * 使用配置的工作线程数运行一个批次。
     */
    public BatchReport run(List<Path> files, FileTask task, ResultSink sink) {
        return run(files, properties.getWorkerCount(), task, sink);
    }

    /**
     * 运行一个批次。
     *
     * @param files       按原始枚举顺序排列的文件，下标即 inputIndex
     * @param workerCount 工作线程数
     * @param task        单文件处理逻辑
     * @param sink        结果输出端
     * @return 按 inputIndex 排列的结果与批次汇总
     */
    public BatchReport run(List<Path> files, int workerCount, FileTask task, ResultSink sink) {
        // ==================== INIT ====================
        validate(files, workerCount, task, sink);

        List<SchedulerState> trail = new ArrayList<>();
        trail.add(SchedulerState.INIT);
        long startTime = System.currentTimeMillis();
        String batchId = IdGenerator.batchId();
        BatchCounters counters = openCounters(batchId);

        int workers = Math.min(workerCount, properties.getMaxWorkers());
        if (workers < workerCount) {
            log.warn("工作线程数 {} 超过上限，按 {} 执行", workerCount, workers);
        }
        log.info("批次 {} 开始: 文件 {} 个, 工作线程 {}", batchId, files.size(), workers);

        List<FileResult> results = workers == 1
                ? runSequential(files, task, sink, counters, trail)
                : runParallel(files, workers, task, sink, counters, trail, batchId);

        int succeeded = (int) results.stream().filter(FileResult::isSuccess).count();
        BatchReport report = BatchReport.builder()
                .batchId(batchId)
                .results(results)
                .succeeded(succeeded)
                .failed(results.size() - succeeded)
                .workerCount(workers)
                .reordered(trail.contains(SchedulerState.REORDERING))
                .stateTrail(trail)
                .counters(snapshot(counters, batchId))
                .elapsedMs(System.currentTimeMillis() - startTime)
                .build();

        log.info("批次 {} 完成: 成功 {}/{}, 失败 {}, 耗时 {}ms",
                batchId, report.getSucceeded(), results.size(), report.getFailed(), report.getElapsedMs());
        return report;
    }

    // ======================== 顺序模式 ========================

    private List<FileResult> runSequential(List<Path> files, FileTask task, ResultSink sink,
                                           BatchCounters counters, List<SchedulerState> trail) {
        trail.add(SchedulerState.DISPATCHING);
        trail.add(SchedulerState.COLLECTING);
        List<FileResult> results = new ArrayList<>(files.size());
        int succeeded = 0;
        for (int idx = 0; idx < files.size(); idx++) {
            FileResult result = execute(task, files.get(idx), idx);
            record(counters, result);
            results.add(result);
            if (result.isSuccess()) {
                succeeded++;
            }
            logProgress(idx + 1, files.size(), succeeded);
            emit(sink, result);
        }
        trail.add(SchedulerState.DONE);
        return results;
    }

    // ======================== 并发模式 ========================

    private List<FileResult> runParallel(List<Path> files, int workers, FileTask task, ResultSink sink,
                                         BatchCounters counters, List<SchedulerState> trail, String batchId) {
        ExecutorService pool = Executors.newFixedThreadPool(workers, namedThreadFactory(batchId));
        try {
            trail.add(SchedulerState.DISPATCHING);
            int totalTasks = files.size();
            List<FileResult> collected = new ArrayList<>(totalTasks);
            ReentrantLock collectLock = new ReentrantLock();
            AtomicInteger completed = new AtomicInteger(0);
            AtomicInteger succeeded = new AtomicInteger(0);

            // 回调里只收集结果，计数放到全部完成之后，计数失败不会让 future 异常
            List<CompletableFuture<Void>> futures = new ArrayList<>(totalTasks);
            for (int idx = 0; idx < totalTasks; idx++) {
                final Path file = files.get(idx);
                final int inputIndex = idx;
                futures.add(CompletableFuture
                        .supplyAsync(() -> execute(task, file, inputIndex), pool)
                        .thenAccept(result -> {
                            collectLock.lock();
                            try {
                                collected.add(result);
                            } finally {
                                collectLock.unlock();
                            }
                            if (result.isSuccess()) {
                                succeeded.incrementAndGet();
                            }
                            logProgress(completed.incrementAndGet(), totalTasks, succeeded.get());
                        }));
            }

            // ==================== COLLECTING ====================
            trail.add(SchedulerState.COLLECTING);
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            List<FileResult> ordered;
            collectLock.lock();
            try {
                ordered = new ArrayList<>(collected);
            } finally {
                collectLock.unlock();
            }
            for (FileResult result : ordered) {
                record(counters, result);
            }

            // ==================== REORDERING ====================
            trail.add(SchedulerState.REORDERING);
            ordered.sort(Comparator.comparingInt(FileResult::getInputIndex));

            // ==================== DONE ====================
            trail.add(SchedulerState.DONE);
            for (FileResult result : ordered) {
                emit(sink, result);
            }
            return ordered;
        } finally {
            pool.shutdown();
        }
    }

    // ======================== 公共步骤 ========================

    /**
     * 执行单个文件任务。任何异常都转为失败占位，保证该文件仍占据自己的 inputIndex。
     */
    private FileResult execute(FileTask task, Path file, int inputIndex) {
        FileResult result;
        try {
            result = task.process(file, inputIndex);
        } catch (Exception e) {
            log.error("文件 #{} 处理异常: {}", inputIndex, file, e);
            return FileResult.failed(inputIndex, String.valueOf(file), "处理异常: " + e.getMessage());
        }
        if (result == null) {
            log.warn("文件 #{} 未返回结果: {}", inputIndex, file);
            return FileResult.failed(inputIndex, String.valueOf(file), "未返回结果");
        }
        if (result.getInputIndex() != inputIndex) {
            log.warn("文件 #{} 返回的 inputIndex={} 与提交顺序不符，已纠正", inputIndex, result.getInputIndex());
            result.setInputIndex(inputIndex);
        }
        return result;
    }

    /**
     * 更新批次计数。失败文件只计入失败数，不进入字段统计。
     * 计数只是统计，写入失败（如 Redis 不可用）记 ERROR 后继续，不影响结果输出。
     */
    private void record(BatchCounters counters, FileResult result) {
        try {
            if (!result.isSuccess()) {
                counters.increment(BatchCounters.FILES_FAILED);
                return;
            }
            counters.increment(BatchCounters.FILES_SUCCEEDED);
            if (result.isMultiMarked()) {
                counters.increment(BatchCounters.FILES_MULTI_MARKED);
            }
            result.getFieldTypeCounts().forEach((type, count) ->
                    counters.incrementBy(BatchCounters.FIELD_TYPE_PREFIX + type, count));
        } catch (RuntimeException e) {
            log.error("文件 #{} 批次计数更新失败: {}", result.getInputIndex(), e.getMessage(), e);
        }
    }

    private BatchCounters openCounters(String batchId) {
        try {
            return counterStore.open(batchId);
        } catch (RuntimeException e) {
            log.error("批次 {} 计数存储不可用，改用内存计数: {}", batchId, e.getMessage(), e);
            return new InMemoryBatchCounters();
        }
    }

    private Map<String, Long> snapshot(BatchCounters counters, String batchId) {
        try {
            return counters.snapshot();
        } catch (RuntimeException e) {
            log.error("批次 {} 读取计数失败: {}", batchId, e.getMessage(), e);
            return Map.of();
        }
    }

    private void emit(ResultSink sink, FileResult result) {
        sinkLock.lock();
        try {
            if (result.isSuccess()) {
                sink.write(result);
            } else {
                sink.writeError(result);
            }
        } finally {
            sinkLock.unlock();
        }
    }

    private void logProgress(int done, int total, int succeeded) {
        int interval = Math.max(1, properties.getProgressLogInterval());
        if (done % interval == 0 || done == total) {
            log.info("识别进度: {}/{} (成功 {})", done, total, succeeded);
        }
    }

    private void validate(List<Path> files, int workerCount, FileTask task, ResultSink sink) {
        if (workerCount < 1) {
            throw new BatchContractException("工作线程数必须 >= 1，实际为 " + workerCount);
        }
        if (files == null) {
            throw new BatchContractException("文件列表不能为空引用");
        }
        for (int i = 0; i < files.size(); i++) {
            if (files.get(i) == null) {
                throw new BatchContractException("第 " + i + " 个文件路径为空");
            }
        }
        if (task == null || sink == null) {
            throw new BatchContractException("处理任务与输出端不能为空");
        }
    }

    private ThreadFactory namedThreadFactory(String batchId) {
        AtomicInteger seq = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable, batchId + "-worker-" + seq.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
