package com.omr.image.config;

import com.omr.common.exception.ImageProcessingException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.javacpp.Loader;
import org.bytedeco.opencv.global.opencv_core;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * 图像模块自动配置。
 * <p>
 * 启动时加载 OpenCV 原生库并校验模糊核参数，原生库缺失时在启动阶段失败，而不是在第一个文件上失败。
 */
@Slf4j
@Configuration
@ComponentScan(basePackages = "com.omr.image")
@EnableConfigurationProperties(OpenCvProperties.class)
@RequiredArgsConstructor
public class ImageModuleConfig {

    private final OpenCvProperties properties;

    @PostConstruct
    public void init() {
        int kSize = properties.getGaussianKernelSize();
        if (properties.isDenoiseEnabled() && (kSize < 1 || kSize % 2 == 0)) {
            throw new ImageProcessingException("高斯模糊核大小必须为正奇数，当前为 " + kSize);
        }
        try {
            Loader.load(opencv_core.class);
        } catch (UnsatisfiedLinkError e) {
            throw new ImageProcessingException("OpenCV 原生库加载失败", e);
        }
        log.info("OpenCV 已加载: 去噪={}, 模糊核={}, 气泡内缩={}px",
                properties.isDenoiseEnabled(), kSize, properties.getBubbleInset());
    }
}
