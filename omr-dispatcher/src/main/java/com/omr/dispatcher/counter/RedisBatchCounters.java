package com.omr.dispatcher.counter;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

/**
 * 单个批次在 Redis Hash 中的计数。
 * <p>
 * HINCRBY 本身是原子操作，多线程递增无需额外加锁。每次递增都会刷新过期时间，
 * 批次结束后 hash 在 ttl 之后自动清除。
 */
@Slf4j
public class RedisBatchCounters implements BatchCounters {

    private final StringRedisTemplate redisTemplate;
    private final String hashKey;
    private final Duration ttl;

    public RedisBatchCounters(StringRedisTemplate redisTemplate, String hashKey, Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.hashKey = hashKey;
        this.ttl = ttl;
    }

    @Override
    public void incrementBy(String key, long delta) {
        redisTemplate.opsForHash().increment(hashKey, key, delta);
        redisTemplate.expire(hashKey, ttl.toSeconds(), TimeUnit.SECONDS);
    }

    @Override
    public Map<String, Long> snapshot() {
        Map<Object, Object> entries = redisTemplate.opsForHash().entries(hashKey);
        Map<String, Long> result = new TreeMap<>();
        for (Map.Entry<Object, Object> entry : entries.entrySet()) {
            result.put(String.valueOf(entry.getKey()), Long.parseLong(String.valueOf(entry.getValue())));
        }
        return Collections.unmodifiableMap(result);
    }

    @Override
    public void reset() {
        redisTemplate.delete(hashKey);
        log.debug("批次计数已清空: {}", hashKey);
    }

    public String getHashKey() {
        return hashKey;
    }
}
