package com.omr.engine.threshold;

import com.omr.common.dto.BubbleSample;
import com.omr.common.dto.ThresholdMethod;
import com.omr.common.dto.ThresholdResult;
import com.omr.engine.config.ThresholdProperties;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * 字段级阈值：只看单个字段的气泡，无法给出可信阈值时退回文件级阈值。
 * <p>
 * 退回规则：
 * 1. 0 或 1 个气泡：直接使用文件级阈值
 * 2. 2 个气泡：两值差距小于 minGapTwoBubbles 时使用文件级阈值，否则取均值
 * 3. 3 个及以上：最大间隙不足 confidentJump 且字段内无离群点时使用文件级阈值；
 *    局部阈值落在灰度上限 255 时一律退回
 */
@Slf4j
public class LocalThresholdStrategy implements ThresholdStrategy {

    private static final double TWO_BUBBLE_CONFIDENCE = 0.7;
    private static final double TWO_BUBBLE_FALLBACK_CONFIDENCE = 0.3;
    private static final double LOW_CONFIDENCE_FALLBACK_CONFIDENCE = 0.4;

    private final ThresholdProperties properties;
    private final double globalFallback;

    public LocalThresholdStrategy(ThresholdProperties properties, double globalFallback) {
        this.properties = properties;
        this.globalFallback = globalFallback;
    }

    @Override
    public ThresholdResult calculate(List<BubbleSample> samples) {
        if (samples.size() < 2) {
            return fallback(0, 0);
        }

        double[] sorted = SampleStatistics.sortedValues(samples);

        if (sorted.length == 2) {
            double gap = sorted[1] - sorted[0];
            if (gap < properties.getMinGapTwoBubbles()) {
                return fallback(TWO_BUBBLE_FALLBACK_CONFIDENCE, gap);
            }
            return ThresholdResult.builder()
                    .value((sorted[0] + sorted[1]) / 2)
                    .confidence(TWO_BUBBLE_CONFIDENCE)
                    .maxJump(gap)
                    .method(ThresholdMethod.LOCAL)
                    .fallbackUsed(false)
                    .build();
        }

        SampleStatistics.Jump jump = SampleStatistics.largestJump(sorted, properties.getLookahead());
        double localValue = jump.threshold();
        double confidentJump = properties.confidentJump();

        // 局部阈值等于灰度上限说明没有找到有意义的间隙
        if (localValue >= ThresholdProperties.MAX_INTENSITY) {
            log.debug("局部阈值退化到灰度上限，使用文件级阈值 {}", globalFallback);
            return fallback(0, jump.size());
        }

        if (jump.size() < confidentJump) {
            double std = SampleStatistics.stdDeviation(samples);
            if (std < properties.getOutlierDeviationThreshold()) {
                return fallback(LOW_CONFIDENCE_FALLBACK_CONFIDENCE, jump.size());
            }
            log.warn("局部阈值置信度低但字段存在离群点，保留局部阈值: value={}, jump={}, std={}",
                    round(localValue), round(jump.size()), round(std));
        }

        return ThresholdResult.builder()
                .value(localValue)
                .confidence(Math.min(1.0, jump.size() / (2 * confidentJump)))
                .maxJump(jump.size())
                .method(ThresholdMethod.LOCAL)
                .fallbackUsed(false)
                .build();
    }

    private ThresholdResult fallback(double confidence, double maxJump) {
        return ThresholdResult.builder()
                .value(globalFallback)
                .confidence(confidence)
                .maxJump(maxJump)
                .method(ThresholdMethod.LOCAL_FALLBACK_TO_GLOBAL)
                .fallbackUsed(true)
                .build();
    }

    private static double round(double v) {
        return Math.round(v * 100) / 100.0;
    }
}
