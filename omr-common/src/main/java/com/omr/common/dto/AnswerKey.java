package com.omr.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 标准答案及计分规则。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnswerKey {

    /** 字段 -> 正确答案 */
    @Builder.Default
    private Map<String, String> questions = new LinkedHashMap<>();

    /** 答对得分 */
    @Builder.Default
    private double correct = 1;

    /** 答错得分（可为负，用于倒扣） */
    @Builder.Default
    private double incorrect = 0;

    /** 未作答得分 */
    @Builder.Default
    private double unmarked = 0;
}
