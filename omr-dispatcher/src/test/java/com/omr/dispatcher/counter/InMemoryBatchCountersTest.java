package com.omr.dispatcher.counter;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryBatchCountersTest {

    private final InMemoryBatchCounters counters = new InMemoryBatchCounters();

    @Test
    void concurrentIncrementsAreNotLost() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 1000; i++) {
                        counters.increment(BatchCounters.FILES_SUCCEEDED);
                        counters.incrementBy(BatchCounters.FIELD_TYPE_PREFIX + "MCQ", 2);
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdown();
        }

        assertThat(counters.get(BatchCounters.FILES_SUCCEEDED)).isEqualTo(8000);
        assertThat(counters.get(BatchCounters.FIELD_TYPE_PREFIX + "MCQ")).isEqualTo(16000);
    }

    @Test
    void snapshotIsReadOnlyAndDetached() {
        counters.increment(BatchCounters.FILES_FAILED);
        Map<String, Long> snapshot = counters.snapshot();
        counters.increment(BatchCounters.FILES_FAILED);

        assertThat(snapshot).containsEntry(BatchCounters.FILES_FAILED, 1L);
        assertThatThrownBy(() -> snapshot.put("x", 1L)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void resetClearsEverything() {
        counters.increment(BatchCounters.FILES_SUCCEEDED);
        counters.reset();

        assertThat(counters.snapshot()).isEmpty();
        assertThat(counters.get(BatchCounters.FILES_SUCCEEDED)).isZero();
    }
}
