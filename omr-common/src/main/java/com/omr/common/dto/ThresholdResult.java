package com.omr.common.dto;

import lombok.Builder;
import lombok.Value;

/**
 * 阈值计算结果：判定阈值 + 置信度。每个文件的每个字段单独生成，不做持久化。
 */
@Value
@Builder
public class ThresholdResult {

    /** 阈值：平均灰度低于此值视为已涂 */
    double value;

    /** 置信度 [0, 1] */
    double confidence;

    /** 找到的最大间隙 */
    double maxJump;

    ThresholdMethod method;

    /** 是否使用了兜底值 */
    boolean fallbackUsed;
}
