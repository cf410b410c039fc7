package com.omr.engine.interpret;

import com.omr.common.dto.BubbleSample;
import com.omr.common.dto.FieldDefinition;
import com.omr.common.dto.FieldInterpretation;
import com.omr.common.dto.ScanQuality;
import com.omr.common.dto.ThresholdResult;
import com.omr.engine.config.ThresholdProperties;
import com.omr.engine.threshold.SampleStatistics;
import com.omr.engine.threshold.ThresholdStrategyFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 字段判读：对一个字段的样本计算阈值，判定哪些选项已涂。
 * <p>
 * 纯函数：相同的样本与兜底阈值总是得到相同的结果。
 * 没有涂任何选项是合法的（未作答）；多涂只是标记，不是错误。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FieldInterpreter {

    private final ThresholdProperties properties;
    private final ThresholdStrategyFactory strategyFactory;

    /**
     * 判读单个字段。
     *
     * @param field          字段定义
     * @param samples        按字段内位置顺序排列的样本
     * @param globalFallback 文件级兜底阈值
     */
    public FieldInterpretation interpret(FieldDefinition field, List<BubbleSample> samples,
                                         double globalFallback) {
        double std = SampleStatistics.stdDeviation(samples);
        ThresholdResult threshold = strategyFactory.forField(globalFallback).calculate(samples);

        List<String> marked = new ArrayList<>();
        int disparity = 0;
        for (BubbleSample sample : samples) {
            boolean localMarked = sample.getMeanIntensity() < threshold.getValue();
            boolean globalMarked = sample.getMeanIntensity() < globalFallback;
            if (localMarked) {
                marked.add(sample.getLabel());
            }
            if (localMarked != globalMarked) {
                disparity++;
            }
        }

        boolean multiMarked = marked.size() > 1;
        if (multiMarked) {
            log.warn("字段 {} 多涂: {}", field.getFieldId(), marked);
        }
        if (disparity > 0) {
            log.warn("字段 {} 局部阈值 {} 与文件阈值 {} 判定不一致的气泡: {} 个",
                    field.getFieldId(), round(threshold.getValue()), round(globalFallback), disparity);
        }

        return FieldInterpretation.builder()
                .fieldId(field.getFieldId())
                .fieldType(field.getFieldType())
                .markedLabels(List.copyOf(marked))
                .multiMarked(multiMarked)
                .threshold(threshold)
                .stdDeviation(std)
                .quality(ScanQuality.fromStdDeviation(std))
                .answer(toAnswer(marked, samples.size()))
                .disparityCount(disparity)
                .build();
    }

    /**
     * 已涂选项拼接为答案；未涂输出空值。两个以上气泡全被判为已涂时多半是扫描问题，按未作答处理。
     */
    private String toAnswer(List<String> marked, int totalBubbles) {
        if (marked.isEmpty()) {
            return properties.getEmptyValue();
        }
        if (properties.isAllMarkedAsEmpty() && totalBubbles > 1 && marked.size() == totalBubbles) {
            return properties.getEmptyValue();
        }
        return String.join("", marked);
    }

    private static double round(double v) {
        return Math.round(v * 100) / 100.0;
    }
}
