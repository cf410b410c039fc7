package com.omr.common.dto;

/**
 * 单个文件的处理状态。
 */
public enum FileStatus {
    SUCCESS, FAILED
}
