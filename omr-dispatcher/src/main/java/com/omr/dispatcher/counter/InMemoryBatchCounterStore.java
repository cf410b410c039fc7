package com.omr.dispatcher.counter;

/**
 * 内存计数存储：每个批次一个新的 {@link InMemoryBatchCounters}，批次结束后随报告一起回收。
 */
public class InMemoryBatchCounterStore implements BatchCounterStore {

    @Override
    public BatchCounters open(String batchId) {
        return new InMemoryBatchCounters();
    }
}
