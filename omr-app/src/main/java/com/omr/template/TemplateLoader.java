package com.omr.template;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.omr.common.dto.AnswerKey;
import com.omr.common.dto.AnswerTemplate;
import com.omr.common.exception.TemplateException;
import com.omr.engine.processing.FileProcessor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 从 JSON 读取模板与标准答案。只做结构映射，不做 JSON Schema 校验。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TemplateLoader {

    private final ObjectMapper objectMapper;

    public AnswerTemplate loadTemplate(Path file) {
        AnswerTemplate template = read(file, AnswerTemplate.class, "模板");
        FileProcessor.validateTemplate(template);
        log.info("模板加载成功: {} (字段 {} 个)", template.getName(), template.getFields().size());
        return template;
    }

    public AnswerKey loadAnswerKey(Path file) {
        AnswerKey key = read(file, AnswerKey.class, "标准答案");
        log.info("标准答案加载成功: 题目 {} 道", key.getQuestions().size());
        return key;
    }

    private <T> T read(Path file, Class<T> type, String what) {
        if (!Files.isRegularFile(file)) {
            throw new TemplateException(what + "文件不存在: " + file);
        }
        try {
            T value = objectMapper.readValue(file.toFile(), type);
            if (value == null) {
                throw new TemplateException(what + "文件为空: " + file);
            }
            return value;
        } catch (IOException e) {
            throw new TemplateException("解析" + what + "文件失败: " + file, e);
        }
    }
}
