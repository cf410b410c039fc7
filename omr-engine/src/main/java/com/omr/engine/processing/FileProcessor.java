package com.omr.engine.processing;

import com.omr.common.dto.AnswerKey;
import com.omr.common.dto.AnswerTemplate;
import com.omr.common.dto.BubbleDefinition;
import com.omr.common.dto.BubbleSample;
import com.omr.common.dto.FieldDefinition;
import com.omr.common.dto.FieldInterpretation;
import com.omr.common.dto.FileResult;
import com.omr.common.dto.FileStatus;
import com.omr.common.dto.ScanQuality;
import com.omr.common.dto.ThresholdResult;
import com.omr.common.exception.OmrException;
import com.omr.common.exception.TemplateException;
import com.omr.common.util.ImageUtils;
import com.omr.engine.aggregate.FileAggregateStore;
import com.omr.engine.detection.ImageAccessor;
import com.omr.engine.detection.SheetImage;
import com.omr.engine.evaluation.AnswerKeyEvaluator;
import com.omr.engine.interpret.FieldInterpreter;
import com.omr.engine.threshold.ThresholdStrategyFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 单文件处理：采样 -> 文件级阈值 -> 逐字段判读 -> 计分，产出带 inputIndex 的结果。
 * <p>
 * 每次调用新建自己的 {@link FileAggregateStore}，调用之间不共享可变状态，可被多个工作线程并发调用。
 * 图片无法读取时整份文件失败（不重试），结果仍保留 inputIndex 占位。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FileProcessor {

    private final FieldInterpreter fieldInterpreter;
    private final ThresholdStrategyFactory strategyFactory;
    private final AnswerKeyEvaluator evaluator;

    public FileResult process(Path filePath, int inputIndex, AnswerTemplate template, ImageAccessor imageAccessor) {
        return process(filePath, inputIndex, template, imageAccessor, null);
    }

    /**
     * 处理一份答题卡。
     *
     * @param answerKey 标准答案，为 null 时不计分
     */
    public FileResult process(Path filePath, int inputIndex, AnswerTemplate template,
                              ImageAccessor imageAccessor, AnswerKey answerKey) {
        long startTime = System.currentTimeMillis();
        String path = filePath.toString();

        if (template == null || template.getFields() == null || template.getFields().isEmpty()) {
            log.warn("模板缺少字段定义，文件 #{} 跳过: {}", inputIndex, path);
            return FileResult.failed(inputIndex, path, "模板缺少字段定义");
        }

        try (SheetImage image = imageAccessor.open(filePath)) {
            FileAggregateStore store = new FileAggregateStore(path, strategyFactory.global());

            // === 第1步：逐字段采样 ===
            for (FieldDefinition field : template.getFields()) {
                store.record(field.getFieldId(), detect(field, image));
            }

            // === 第2步：文件级兜底阈值（仅计算一次） ===
            ThresholdResult global = store.globalThresholdForFile();

            // === 第3步：逐字段判读 ===
            for (FieldDefinition field : template.getFields()) {
                List<BubbleSample> samples = store.samplesFor(field.getFieldId());
                if (samples.isEmpty()) {
                    log.warn("字段 {} 没有气泡区域，按未作答处理 - {}", field.getFieldId(), path);
                }
                store.putInterpretation(fieldInterpreter.interpret(field, samples, global.getValue()));
            }
            store.finish();

            FileResult result = toResult(store, inputIndex, answerKey);
            result.setProcessingTimeMs(System.currentTimeMillis() - startTime);
            log.info("文件 #{} 识别完成: 字段 {} 个, 文件阈值 {}, 多涂 {}, 耗时 {}ms - {}",
                    inputIndex, store.interpretations().size(), Math.round(global.getValue() * 100) / 100.0,
                    result.isMultiMarked(), result.getProcessingTimeMs(), path);
            return result;

        } catch (OmrException e) {
            log.warn("文件 #{} 处理失败: [{}] {} - {}", inputIndex, e.getErrorCode(), e.getMessage(), path);
            FileResult failed = FileResult.failed(inputIndex, path, e.getMessage());
            failed.setProcessingTimeMs(System.currentTimeMillis() - startTime);
            return failed;
        }
    }

    /**
     * 批次开始前的模板形状校验：字段标识非空且不重复，气泡列表存在且标签非空。
     * 不通过时直接抛出，不派发任何文件。
     */
    public static void validateTemplate(AnswerTemplate template) {
        if (template == null || template.getFields() == null) {
            throw new TemplateException("模板为空");
        }
        Set<String> seen = new HashSet<>();
        for (FieldDefinition field : template.getFields()) {
            if (field.getFieldId() == null || field.getFieldId().isBlank()) {
                throw new TemplateException("字段标识不能为空");
            }
            if (!seen.add(field.getFieldId())) {
                throw new TemplateException("字段标识重复: " + field.getFieldId());
            }
            if (field.getBubbles() == null) {
                throw new TemplateException("字段 " + field.getFieldId() + " 缺少气泡列表");
            }
            for (BubbleDefinition bubble : field.getBubbles()) {
                if (bubble.getLabel() == null) {
                    throw new TemplateException("字段 " + field.getFieldId() + " 存在没有标签的气泡");
                }
            }
        }
    }

    private List<BubbleSample> detect(FieldDefinition field, SheetImage image) {
        List<BubbleDefinition> bubbles = field.getBubbles() != null ? field.getBubbles() : List.of();
        List<BubbleSample> samples = new ArrayList<>(bubbles.size());
        for (BubbleDefinition bubble : bubbles) {
            samples.add(BubbleSample.builder()
                    .meanIntensity(ImageUtils.clampIntensity(image.meanIntensity(bubble)))
                    .bubble(bubble)
                    .build());
        }
        return samples;
    }

    private FileResult toResult(FileAggregateStore store, int inputIndex, AnswerKey answerKey) {
        Map<String, String> response = new LinkedHashMap<>();
        List<String> multiMarkedFields = new ArrayList<>();
        Map<ScanQuality, Integer> quality = new EnumMap<>(ScanQuality.class);
        Map<String, Integer> typeCounts = new LinkedHashMap<>();

        for (FieldInterpretation interpretation : store.interpretations().values()) {
            response.put(interpretation.getFieldId(), interpretation.getAnswer());
            if (interpretation.isMultiMarked()) {
                multiMarkedFields.add(interpretation.getFieldId());
            }
            quality.merge(interpretation.getQuality(), 1, Integer::sum);
            typeCounts.merge(interpretation.getFieldType(), 1, Integer::sum);
        }

        return FileResult.builder()
                .inputIndex(inputIndex)
                .filePath(store.getFilePath())
                .status(FileStatus.SUCCESS)
                .omrResponse(response)
                .multiMarked(!multiMarkedFields.isEmpty())
                .multiMarkedFields(multiMarkedFields)
                .qualitySummary(quality)
                .fieldTypeCounts(typeCounts)
                .score(answerKey != null ? evaluator.evaluate(response, answerKey) : null)
                .build();
    }
}
