package com.omr.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 模板中的单个气泡区域：一个可选答案选项。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BubbleDefinition {

    /** 选项标签，如 "A"、"B"、"3" */
    private String label;

    /** 区域左上角 X 坐标（像素） */
    private int x;

    /** 区域左上角 Y 坐标（像素） */
    private int y;

    /** 区域宽度 */
    private int width;

    /** 区域高度 */
    private int height;
}
