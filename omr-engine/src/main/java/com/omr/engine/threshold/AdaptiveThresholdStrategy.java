package com.omr.engine.threshold;

import com.omr.common.dto.BubbleSample;
import com.omr.common.dto.ThresholdMethod;
import com.omr.common.dto.ThresholdResult;

import java.util.ArrayList;
import java.util.List;

/**
 * 组合策略：各策略结果按 置信度 × 权重 加权平均。
 * 置信度取各策略最大值，任一策略使用了兜底则结果标记为兜底。
 */
public class AdaptiveThresholdStrategy implements ThresholdStrategy {

    private final List<ThresholdStrategy> strategies;
    private final List<Double> weights;
    private final double defaultThreshold;

    public AdaptiveThresholdStrategy(List<ThresholdStrategy> strategies, List<Double> weights,
                                     double defaultThreshold) {
        if (strategies.isEmpty() || strategies.size() != weights.size()) {
            throw new IllegalArgumentException("策略数量与权重数量必须一致且不能为空");
        }
        this.strategies = List.copyOf(strategies);
        this.weights = List.copyOf(weights);
        this.defaultThreshold = defaultThreshold;
    }

    @Override
    public ThresholdResult calculate(List<BubbleSample> samples) {
        List<ThresholdResult> results = new ArrayList<>(strategies.size());
        for (ThresholdStrategy strategy : strategies) {
            results.add(strategy.calculate(samples));
        }

        double totalWeight = 0;
        double weightedSum = 0;
        double maxConfidence = 0;
        double maxJump = 0;
        boolean anyFallback = false;
        for (int i = 0; i < results.size(); i++) {
            ThresholdResult r = results.get(i);
            double w = r.getConfidence() * weights.get(i);
            totalWeight += w;
            weightedSum += r.getValue() * w;
            maxConfidence = Math.max(maxConfidence, r.getConfidence());
            maxJump = Math.max(maxJump, r.getMaxJump());
            anyFallback |= r.isFallbackUsed();
        }

        if (totalWeight == 0) {
            return ThresholdResult.builder()
                    .value(defaultThreshold)
                    .confidence(0)
                    .maxJump(0)
                    .method(ThresholdMethod.ADAPTIVE)
                    .fallbackUsed(true)
                    .build();
        }

        return ThresholdResult.builder()
                .value(weightedSum / totalWeight)
                .confidence(maxConfidence)
                .maxJump(maxJump)
                .method(ThresholdMethod.ADAPTIVE)
                .fallbackUsed(anyFallback)
                .build();
    }
}
