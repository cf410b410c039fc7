package com.omr.dispatcher.counter;

/**
 * 批次计数的存储后端。每个批次通过 {@link #open(String)} 拿到自己独立的一组计数，
 * 同时运行的批次（同进程或多实例）互不影响。
 */
public interface BatchCounterStore {

    /**
     * 为批次创建一组清零的计数。
     *
     * @param batchId 批次 ID，同一存储内必须唯一
     */
    BatchCounters open(String batchId);
}
