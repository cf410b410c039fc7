package com.omr.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 单个答题卡文件的识别结果。inputIndex 是输出排序的唯一依据。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FileResult {

    /** 文件在原始输入枚举中的位置 */
    private int inputIndex;

    /** 文件路径 */
    private String filePath;

    @Builder.Default
    private FileStatus status = FileStatus.SUCCESS;

    /** 字段 -> 答案字符串，按模板字段顺序 */
    @Builder.Default
    private Map<String, String> omrResponse = new LinkedHashMap<>();

    /** 是否有任意字段多涂 */
    private boolean multiMarked;

    /** 多涂的字段 */
    @Builder.Default
    private List<String> multiMarkedFields = new ArrayList<>();

    /** 各扫描质量等级的字段数 */
    @Builder.Default
    private Map<ScanQuality, Integer> qualitySummary = new EnumMap<>(ScanQuality.class);

    /** 按字段类型统计的字段数 */
    @Builder.Default
    private Map<String, Integer> fieldTypeCounts = new LinkedHashMap<>();

    /** 得分（未配置答案时为 null） */
    private Double score;

    /** 失败原因（仅 FAILED） */
    private String errorReason;

    /** 处理耗时（毫秒） */
    private long processingTimeMs;

    public boolean isSuccess() {
        return status == FileStatus.SUCCESS;
    }

    /**
     * 构造一个失败结果，保留其 inputIndex 占位。
     */
    public static FileResult failed(int inputIndex, String filePath, String reason) {
        return FileResult.builder()
                .inputIndex(inputIndex)
                .filePath(filePath)
                .status(FileStatus.FAILED)
                .errorReason(reason)
                .build();
    }
}
