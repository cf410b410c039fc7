package com.omr.dispatcher.counter;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 基于内存的批次计数，所有读写在同一把锁内完成，锁只覆盖内存中的计数更新。
 */
@Slf4j
public class InMemoryBatchCounters implements BatchCounters {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Long> counts = new TreeMap<>();

    @Override
    public void incrementBy(String key, long delta) {
        lock.lock();
        try {
            counts.merge(key, delta, Long::sum);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Map<String, Long> snapshot() {
        lock.lock();
        try {
            return Collections.unmodifiableMap(new TreeMap<>(counts));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void reset() {
        lock.lock();
        try {
            counts.clear();
        } finally {
            lock.unlock();
        }
        log.debug("批次计数已清空");
    }
}
