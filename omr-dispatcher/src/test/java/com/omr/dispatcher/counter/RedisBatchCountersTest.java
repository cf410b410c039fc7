package com.omr.dispatcher.counter;

import com.omr.dispatcher.config.DispatcherProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisBatchCountersTest {

    private static final String PREFIX = "omr:batch:counters";

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private HashOperations<String, Object, Object> hashOps;

    private DispatcherProperties properties;
    private RedisBatchCounterStore store;

    @BeforeEach
    void setUp() {
        properties = new DispatcherProperties();
        properties.setCounterTtl(Duration.ofHours(2));
        store = new RedisBatchCounterStore(redisTemplate, properties);
    }

    @Test
    void eachBatchGetsItsOwnHash() {
        RedisBatchCounters first = (RedisBatchCounters) store.open("batch-a");
        RedisBatchCounters second = (RedisBatchCounters) store.open("batch-b");

        assertThat(first.getHashKey()).isEqualTo(PREFIX + ":batch-a");
        assertThat(second.getHashKey()).isEqualTo(PREFIX + ":batch-b");
        verify(redisTemplate).delete(PREFIX + ":batch-a");
        verify(redisTemplate).delete(PREFIX + ":batch-b");
        verify(redisTemplate, never()).delete(PREFIX);
    }

    @Test
    void incrementUsesHashIncrementAndRefreshesExpiry() {
        when(redisTemplate.<Object, Object>opsForHash()).thenReturn(hashOps);
        BatchCounters counters = store.open("batch-a");

        counters.increment(BatchCounters.FILES_SUCCEEDED);
        counters.incrementBy(BatchCounters.FIELD_TYPE_PREFIX + "INT", 4);

        verify(hashOps).increment(PREFIX + ":batch-a", BatchCounters.FILES_SUCCEEDED, 1L);
        verify(hashOps).increment(PREFIX + ":batch-a", BatchCounters.FIELD_TYPE_PREFIX + "INT", 4L);
        verify(redisTemplate, times(2)).expire(PREFIX + ":batch-a", 7200L, TimeUnit.SECONDS);
    }

    @Test
    void snapshotReadsOnlyThisBatch() {
        when(redisTemplate.<Object, Object>opsForHash()).thenReturn(hashOps);
        when(hashOps.entries(PREFIX + ":batch-a")).thenReturn(Map.of(
                BatchCounters.FILES_SUCCEEDED, "12",
                BatchCounters.FILES_FAILED, "1"));
        BatchCounters counters = store.open("batch-a");

        assertThat(counters.snapshot())
                .containsEntry(BatchCounters.FILES_SUCCEEDED, 12L)
                .containsEntry(BatchCounters.FILES_FAILED, 1L);
        assertThat(counters.get(BatchCounters.FILES_MULTI_MARKED)).isZero();
    }
}
