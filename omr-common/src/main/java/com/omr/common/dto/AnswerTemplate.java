package com.omr.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 答题卡模板：有序的字段列表。模板的加载与校验不属于判读引擎。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnswerTemplate {

    /** 模板名称 */
    private String name;

    /** 字段列表（输出顺序即此顺序） */
    @Builder.Default
    private List<FieldDefinition> fields = new ArrayList<>();
}
