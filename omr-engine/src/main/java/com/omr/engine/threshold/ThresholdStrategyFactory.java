package com.omr.engine.threshold;

import com.omr.engine.config.ThresholdProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 按配置创建阈值策略。字段级策略绑定当前文件的兜底阈值，每个字段新建一个。
 */
@Component
@RequiredArgsConstructor
public class ThresholdStrategyFactory {

    private final ThresholdProperties properties;

    public ThresholdStrategy global() {
        return new GlobalThresholdStrategy(properties);
    }

    public ThresholdStrategy forField(double globalFallback) {
        LocalThresholdStrategy local = new LocalThresholdStrategy(properties, globalFallback);
        if (properties.getMode() == ThresholdProperties.ThresholdMode.ADAPTIVE) {
            return new AdaptiveThresholdStrategy(
                    List.of(global(), local),
                    List.of(properties.getGlobalWeight(), properties.getLocalWeight()),
                    properties.getDefaultThreshold());
        }
        return local;
    }
}
