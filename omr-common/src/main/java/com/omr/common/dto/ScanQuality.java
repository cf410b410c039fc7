package com.omr.common.dto;

/**
 * 扫描质量评估：灰度离散程度越高，涂与未涂两簇分得越开。
 */
public enum ScanQuality {
    EXCELLENT, GOOD, ACCEPTABLE, POOR;

    public static ScanQuality fromStdDeviation(double std) {
        if (std > 50) return EXCELLENT;
        if (std > 30) return GOOD;
        if (std > 15) return ACCEPTABLE;
        return POOR;
    }
}
