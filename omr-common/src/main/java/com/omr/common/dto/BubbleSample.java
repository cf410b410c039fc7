package com.omr.common.dto;

import lombok.Builder;
import lombok.Value;

/**
 * 一个气泡区域的测量结果：平均灰度 + 对应的气泡定义。创建后不可变。
 */
@Value
@Builder
public class BubbleSample {

    /** 平均灰度 (0=黑, 255=白) */
    double meanIntensity;

    /** 对应的气泡定义（标签 + 位置） */
    BubbleDefinition bubble;

    public String getLabel() {
        return bubble != null ? bubble.getLabel() : "";
    }

    public static BubbleSample of(String label, double meanIntensity) {
        return BubbleSample.builder()
                .meanIntensity(meanIntensity)
                .bubble(BubbleDefinition.builder().label(label).build())
                .build();
    }
}
