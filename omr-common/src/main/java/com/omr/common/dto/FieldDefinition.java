package com.omr.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 模板中的一个字段（一道题、学号的一位等），包含按位置排列的气泡区域。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FieldDefinition {

    /** 字段标识，如 "q1"、"roll_3" */
    private String fieldId;

    /** 字段类型，如 MCQ4 / INT，用于批次按类型计数 */
    @Builder.Default
    private String fieldType = "MCQ";

    /** 气泡区域，按自然位置顺序排列 */
    @Builder.Default
    private List<BubbleDefinition> bubbles = new ArrayList<>();
}
