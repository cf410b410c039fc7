package com.omr;

import com.omr.config.AppProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * 答题卡识别系统 - 启动类。
 */
@SpringBootApplication(scanBasePackages = "com.omr")
@EnableConfigurationProperties(AppProperties.class)
public class OmrApplication {

    public static void main(String[] args) {
        SpringApplication.run(OmrApplication.class, args);
    }
}
