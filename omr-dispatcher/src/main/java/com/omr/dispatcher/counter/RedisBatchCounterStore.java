package com.omr.dispatcher.counter;

import com.omr.dispatcher.config.DispatcherProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis 计数存储：每个批次一个 hash，key 为 {@code counterKeyName:batchId}，过期时间由 counterTtl 控制。
 */
@Slf4j
public class RedisBatchCounterStore implements BatchCounterStore {

    private final StringRedisTemplate redisTemplate;
    private final DispatcherProperties properties;

    public RedisBatchCounterStore(StringRedisTemplate redisTemplate, DispatcherProperties properties) {
        this.redisTemplate = redisTemplate;
        this.properties = properties;
    }

    @Override
    public BatchCounters open(String batchId) {
        String hashKey = properties.getCounterKeyName() + ":" + batchId;
        RedisBatchCounters counters = new RedisBatchCounters(redisTemplate, hashKey, properties.getCounterTtl());
        counters.reset();
        log.debug("批次计数 hash: {} (过期 {})", hashKey, properties.getCounterTtl());
        return counters;
    }
}
