package com.omr.config;

import com.omr.common.dto.AnswerKey;
import com.omr.common.dto.AnswerTemplate;
import com.omr.common.dto.FieldDefinition;
import com.omr.common.dto.FileResult;
import com.omr.common.exception.OmrException;
import com.omr.common.util.ImageUtils;
import com.omr.dispatcher.service.BatchReport;
import com.omr.dispatcher.service.BatchScheduler;
import com.omr.engine.detection.ImageAccessor;
import com.omr.engine.processing.FileProcessor;
import com.omr.output.CsvResultSink;
import com.omr.template.TemplateLoader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * 应用启动时，对配置的目录执行一次批量识别。
 * <p>
 * 配置方式（在 application.yml 中）：
 * omr.input-dir / omr.template-file / omr.answer-key-file / omr.output-dir
 * <p>
 * 或通过环境变量：OMR_INPUT_DIR、OMR_TEMPLATE_FILE 等
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BatchRunner implements CommandLineRunner {

    private final AppProperties appProperties;
    private final TemplateLoader templateLoader;
    private final FileProcessor fileProcessor;
    private final ImageAccessor imageAccessor;
    private final BatchScheduler scheduler;

    @Override
    public void run(String... args) throws IOException {
        String inputDir = appProperties.getInputDir();
        if (inputDir == null || inputDir.isBlank()) {
            log.warn("==============================================");
            log.warn("  未配置答题卡目录！");
            log.warn("  请在 application.yml 中设置: omr.input-dir");
            log.warn("  或通过环境变量: OMR_INPUT_DIR");
            log.warn("==============================================");
            return;
        }

        // 模板、答案不合法属于批次级错误，在派发任何文件前直接抛出
        AnswerTemplate template = templateLoader.loadTemplate(Path.of(appProperties.getTemplateFile()));
        AnswerKey answerKey = null;
        if (appProperties.getAnswerKeyFile() != null && !appProperties.getAnswerKeyFile().isBlank()) {
            answerKey = templateLoader.loadAnswerKey(Path.of(appProperties.getAnswerKeyFile()));
        }

        List<Path> files = listImages(Path.of(inputDir));
        if (files.isEmpty()) {
            log.warn("目录中没有可识别的图片: {}", inputDir);
            return;
        }

        List<String> fieldIds = template.getFields().stream().map(FieldDefinition::getFieldId).toList();
        final AnswerKey key = answerKey;
        BatchReport report;
        try (CsvResultSink sink = new CsvResultSink(Path.of(appProperties.getOutputDir()), fieldIds)) {
            report = scheduler.run(files,
                    (file, inputIndex) -> fileProcessor.process(file, inputIndex, template, imageAccessor, key),
                    sink);
        }

        log.info("========== 批次汇总 ==========");
        log.info("批次: {}", report.getBatchId());
        log.info("成功: {}, 失败: {}, 共 {}", report.getSucceeded(), report.getFailed(), report.getResults().size());
        log.info("计数: {}", report.getCounters());
        for (FileResult failed : report.failedResults()) {
            log.warn("失败文件 #{}: {} - {}", failed.getInputIndex(), failed.getFilePath(), failed.getErrorReason());
        }
        log.info("==============================");
    }

    /**
     * 递归列出图片，按路径排序，排序后的位置即 inputIndex。
     */
    static List<Path> listImages(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            throw new OmrException(OmrException.INPUT_ERROR, "答题卡目录不存在: " + dir);
        }
        try (Stream<Path> stream = Files.walk(dir)) {
            return stream.filter(Files::isRegularFile)
                    .filter(ImageUtils::isImageFile)
                    .sorted()
                    .toList();
        }
    }
}
