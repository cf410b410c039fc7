package com.omr.engine.threshold;

import com.omr.common.dto.BubbleSample;
import com.omr.common.dto.ThresholdResult;

import java.util.List;

/**
 * 阈值计算策略：由一组气泡样本得出判定阈值与置信度。
 * <p>
 * 实现：
 * - {@link GlobalThresholdStrategy}：文件级，所有字段的样本
 * - {@link LocalThresholdStrategy}：字段级，置信不足时退回文件级阈值
 * - {@link AdaptiveThresholdStrategy}：多种策略按置信度加权
 */
public interface ThresholdStrategy {

    /**
     * 计算阈值。样本顺序不影响结果。
     */
    ThresholdResult calculate(List<BubbleSample> samples);
}
