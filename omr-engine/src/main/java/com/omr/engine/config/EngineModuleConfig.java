package com.omr.engine.config;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * 判读引擎模块自动配置。启动时校验阈值参数，非法配置直接拒绝启动。
 */
@Slf4j
@Configuration
@ComponentScan(basePackages = "com.omr.engine")
@EnableConfigurationProperties(ThresholdProperties.class)
@RequiredArgsConstructor
public class EngineModuleConfig {

    private final ThresholdProperties properties;

    @PostConstruct
    public void init() {
        if (properties.getLookahead() < 1) {
            throw new IllegalStateException("omr.threshold.lookahead 必须 >= 1，当前为 " + properties.getLookahead());
        }
        if (properties.getMinJump() <= 0) {
            throw new IllegalStateException("omr.threshold.min-jump 必须为正数，当前为 " + properties.getMinJump());
        }
        if (properties.confidentJump() <= 0) {
            throw new IllegalStateException("omr.threshold.min-jump + min-jump-surplus 必须为正数，当前为 "
                    + properties.confidentJump());
        }
        if (properties.getGlobalWeight() < 0 || properties.getLocalWeight() < 0) {
            throw new IllegalStateException("omr.threshold 权重不能为负");
        }
        log.info("阈值判读: 模式={}, minJump={}, 可信间隙={}, 默认阈值={}",
                properties.getMode(), properties.getMinJump(), properties.confidentJump(),
                properties.getDefaultThreshold());
    }
}
