package com.omr.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 批量识别的输入输出配置。
 */
@Data
@ConfigurationProperties(prefix = "omr")
public class AppProperties {

    /** 答题卡图片目录（递归查找） */
    private String inputDir;

    /** 模板 JSON 文件 */
    private String templateFile = "template.json";

    /** 标准答案 JSON 文件（可选，不配置则不计分） */
    private String answerKeyFile;

    /** 结果输出目录 */
    private String outputDir = "outputs";
}
