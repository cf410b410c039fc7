package com.omr.engine.aggregate;

import com.omr.common.dto.BubbleSample;
import com.omr.common.dto.FieldInterpretation;
import com.omr.common.dto.ThresholdResult;
import com.omr.engine.threshold.ThresholdStrategy;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 单个文件的聚合数据：所有字段的样本、字段判读结果、文件级阈值。
 * <p>
 * 每个文件处理任务新建一个实例，不在并发任务间共享，因此不做同步。
 * 文件级阈值首次查询时计算并缓存，之后记录新样本会被拒绝。
 */
@Slf4j
public class FileAggregateStore {

    private final String filePath;
    private final ThresholdStrategy globalStrategy;

    private final Map<String, List<BubbleSample>> fieldSamples = new LinkedHashMap<>();
    private final List<BubbleSample> allSamples = new ArrayList<>();
    private final Map<String, FieldInterpretation> interpretations = new LinkedHashMap<>();

    private ThresholdResult globalThreshold;
    private boolean finished;

    public FileAggregateStore(String filePath, ThresholdStrategy globalStrategy) {
        this.filePath = filePath;
        this.globalStrategy = globalStrategy;
    }

    /**
     * 记录一个字段的样本。
     */
    public void record(String fieldId, List<BubbleSample> samples) {
        if (globalThreshold != null || finished) {
            throw new IllegalStateException("文件级阈值已计算，不能再记录样本: " + filePath);
        }
        List<BubbleSample> copy = List.copyOf(samples);
        fieldSamples.put(fieldId, copy);
        allSamples.addAll(copy);
    }

    public List<BubbleSample> samplesFor(String fieldId) {
        return fieldSamples.getOrDefault(fieldId, List.of());
    }

    public List<BubbleSample> allSamplesForFile() {
        return Collections.unmodifiableList(allSamples);
    }

    /**
     * 文件级阈值，仅计算一次。
     */
    public ThresholdResult globalThresholdForFile() {
        if (globalThreshold == null) {
            globalThreshold = globalStrategy.calculate(allSamples);
            log.debug("文件级阈值: {} (置信度 {}, 样本 {} 个) - {}",
                    globalThreshold.getValue(), globalThreshold.getConfidence(), allSamples.size(), filePath);
        }
        return globalThreshold;
    }

    public void putInterpretation(FieldInterpretation interpretation) {
        if (finished) {
            throw new IllegalStateException("文件聚合已结束: " + filePath);
        }
        interpretations.put(interpretation.getFieldId(), interpretation);
    }

    /**
     * 字段判读结果，按记录顺序。
     */
    public Map<String, FieldInterpretation> interpretations() {
        return Collections.unmodifiableMap(interpretations);
    }

    public void finish() {
        finished = true;
    }

    public boolean isFinished() {
        return finished;
    }

    public String getFilePath() {
        return filePath;
    }
}
