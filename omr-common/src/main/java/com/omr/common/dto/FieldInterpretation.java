package com.omr.common.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 单个字段的判读结果。不变式：multiMarked == markedLabels.size() > 1。
 */
@Value
@Builder
public class FieldInterpretation {

    String fieldId;

    String fieldType;

    /** 低于阈值的选项标签，按字段内位置顺序 */
    List<String> markedLabels;

    boolean multiMarked;

    ThresholdResult threshold;

    /** 字段内气泡灰度的总体标准差 */
    double stdDeviation;

    ScanQuality quality;

    /** 输出到结果表的答案字符串 */
    String answer;

    /** 局部阈值与文件级阈值判定不一致的气泡数 */
    int disparityCount;
}
