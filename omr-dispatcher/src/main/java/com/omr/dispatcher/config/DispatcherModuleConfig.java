package com.omr.dispatcher.config;

import com.omr.dispatcher.counter.BatchCounterStore;
import com.omr.dispatcher.counter.InMemoryBatchCounterStore;
import com.omr.dispatcher.counter.RedisBatchCounterStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * 调度模块自动配置。
 * <p>
 * 通过 {@code omr.dispatcher.storage-type} 切换批次计数的存储实现：
 * <ul>
 *   <li>{@code memory}（默认）：纯内存，零外部依赖，适合单机部署</li>
 *   <li>{@code redis}：Redis 实现，每个批次一个 hash，多实例可查看彼此的批次统计</li>
 * </ul>
 */
@Slf4j
@Configuration
@ComponentScan(basePackages = "com.omr.dispatcher")
@EnableConfigurationProperties(DispatcherProperties.class)
public class DispatcherModuleConfig {

    @Bean
    @ConditionalOnProperty(name = "omr.dispatcher.storage-type", havingValue = "memory", matchIfMissing = true)
    public BatchCounterStore inMemoryBatchCounterStore() {
        log.info("使用内存批次计数（单机模式，无需 Redis）");
        return new InMemoryBatchCounterStore();
    }

    @Bean
    @ConditionalOnProperty(name = "omr.dispatcher.storage-type", havingValue = "redis")
    public BatchCounterStore redisBatchCounterStore(StringRedisTemplate redisTemplate,
                                                    DispatcherProperties properties) {
        log.info("使用 Redis 批次计数（分布式模式），key 前缀 {}", properties.getCounterKeyName());
        return new RedisBatchCounterStore(redisTemplate, properties);
    }
}
