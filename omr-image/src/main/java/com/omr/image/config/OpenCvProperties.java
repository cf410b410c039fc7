package com.omr.image.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * OpenCV 图像处理相关配置。
 */
@Data
@ConfigurationProperties(prefix = "omr.opencv")
public class OpenCvProperties {

    /** 采样前是否做高斯模糊去噪 */
    private boolean denoiseEnabled = true;

    /** 高斯模糊核大小（必须为奇数） */
    private int gaussianKernelSize = 3;

    /** 气泡区域四周向内收缩的像素，避开印刷的圆圈边框 */
    private int bubbleInset = 2;
}
