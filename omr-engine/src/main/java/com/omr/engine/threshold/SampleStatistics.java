package com.omr.engine.threshold;

import com.omr.common.dto.BubbleSample;

import java.util.Arrays;
import java.util.List;

/**
 * 样本灰度的统计工具。
 */
public final class SampleStatistics {

    private SampleStatistics() {
    }

    public static double[] sortedValues(List<BubbleSample> samples) {
        double[] values = new double[samples.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = samples.get(i).getMeanIntensity();
        }
        Arrays.sort(values);
        return values;
    }

    public static double mean(List<BubbleSample> samples) {
        if (samples.isEmpty()) return 0;
        double sum = 0;
        for (BubbleSample s : samples) {
            sum += s.getMeanIntensity();
        }
        return sum / samples.size();
    }

    /**
     * 总体标准差（除以 N）。
     */
    public static double stdDeviation(List<BubbleSample> samples) {
        if (samples.isEmpty()) return 0;
        double mean = mean(samples);
        double sq = 0;
        for (BubbleSample s : samples) {
            double d = s.getMeanIntensity() - mean;
            sq += d * d;
        }
        return Math.sqrt(sq / samples.size());
    }

    /**
     * 在升序数组中查找最大间隙 v[i+w] - v[i]，阈值取间隙中点。
     * 调用方保证至少两个值。
     */
    public static Jump largestJump(double[] sorted, int lookahead) {
        int w = Math.max(1, Math.min(lookahead, sorted.length - 1));
        double maxJump = -1;
        double threshold = sorted[0];
        for (int i = 0; i + w < sorted.length; i++) {
            double jump = sorted[i + w] - sorted[i];
            if (jump > maxJump) {
                maxJump = jump;
                threshold = sorted[i] + jump / 2;
            }
        }
        return new Jump(maxJump, threshold);
    }

    /**
     * 最大间隙及其中点。
     */
    public static final class Jump {

        private final double size;
        private final double threshold;

        Jump(double size, double threshold) {
            this.size = size;
            this.threshold = threshold;
        }

        public double size() {
            return size;
        }

        public double threshold() {
            return threshold;
        }
    }
}
