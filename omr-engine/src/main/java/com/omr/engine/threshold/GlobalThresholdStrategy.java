package com.omr.engine.threshold;

import com.omr.common.dto.BubbleSample;
import com.omr.common.dto.ThresholdMethod;
import com.omr.common.dto.ThresholdResult;
import com.omr.engine.config.ThresholdProperties;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * 文件级阈值：整份答题卡所有气泡灰度排序后的最大间隙。
 * <p>
 * 已涂气泡聚在低灰度一端，未涂的聚在高灰度一端，最大间隙最可能是两簇的分界。
 */
@Slf4j
public class GlobalThresholdStrategy implements ThresholdStrategy {

    private final ThresholdProperties properties;

    public GlobalThresholdStrategy(ThresholdProperties properties) {
        this.properties = properties;
    }

    @Override
    public ThresholdResult calculate(List<BubbleSample> samples) {
        if (samples.size() < 2) {
            log.debug("样本不足 ({} 个)，使用默认阈值 {}", samples.size(), properties.getDefaultThreshold());
            return ThresholdResult.builder()
                    .value(properties.getDefaultThreshold())
                    .confidence(0)
                    .maxJump(0)
                    .method(ThresholdMethod.GLOBAL)
                    .fallbackUsed(true)
                    .build();
        }

        double[] sorted = SampleStatistics.sortedValues(samples);
        SampleStatistics.Jump jump = SampleStatistics.largestJump(sorted, properties.getLookahead());
        double confidence = Math.min(1.0, jump.size() / (3 * properties.getMinJump()));
        boolean weak = jump.size() < properties.getMinJump();

        if (weak) {
            log.debug("文件级最大间隙 {} 低于 minJump {}，阈值可信度低", jump.size(), properties.getMinJump());
        }
        return ThresholdResult.builder()
                .value(jump.threshold())
                .confidence(confidence)
                .maxJump(jump.size())
                .method(ThresholdMethod.GLOBAL)
                .fallbackUsed(weak)
                .build();
    }
}
