package com.omr.common.dto;

/**
 * 阈值的计算方式。
 */
public enum ThresholdMethod {
    /** 整份文件所有气泡的最大间隙 */
    GLOBAL,
    /** 单个字段内的最大间隙 */
    LOCAL,
    /** 字段内无法给出可信阈值，退回文件级阈值 */
    LOCAL_FALLBACK_TO_GLOBAL,
    /** 多种策略按置信度加权 */
    ADAPTIVE
}
