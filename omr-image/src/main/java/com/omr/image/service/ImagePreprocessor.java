package com.omr.image.service;

import com.omr.common.exception.ImageProcessingException;
import com.omr.image.config.OpenCvProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.opencv.global.opencv_imgcodecs;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Size;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.bytedeco.opencv.global.opencv_imgproc.GaussianBlur;

/**
 * 图像预处理服务：读取灰度图、去噪。几何矫正由上游完成。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ImagePreprocessor {

    private final OpenCvProperties properties;

    /**
     * 从文件读取灰度图。
     * 先读成字节再解码，避免 imread 对非 ASCII 路径的兼容问题。
     */
    public Mat readGrayscale(Path file) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            throw ImageProcessingException.unreadable(file, "读取图片失败", e);
        }
        if (bytes.length == 0) {
            throw new ImageProcessingException("图片文件为空: " + file);
        }

        try {
            Mat gray = opencv_imgcodecs.imdecode(new Mat(bytes), opencv_imgcodecs.IMREAD_GRAYSCALE);
            if (gray.empty()) {
                throw new ImageProcessingException("无法解码图片，请确认图片格式正确: " + file);
            }
            log.debug("图片读取成功: {}x{} - {}", gray.cols(), gray.rows(), file);
            return gray;
        } catch (ImageProcessingException e) {
            throw e;
        } catch (Exception e) {
            throw ImageProcessingException.unreadable(file, "解码图片失败", e);
        }
    }

    /**
     * 高斯模糊去噪。
     */
    public Mat denoise(Mat gray) {
        if (!properties.isDenoiseEnabled()) {
            return gray;
        }
        Mat blurred = new Mat();
        int kSize = properties.getGaussianKernelSize();
        GaussianBlur(gray, blurred, new Size(kSize, kSize), 0);
        return blurred;
    }

    /**
     * 完整的预处理流水线：读取灰度 -> 去噪。
     */
    public Mat preprocess(Path file) {
        Mat gray = readGrayscale(file);
        Mat denoised = denoise(gray);
        if (denoised != gray) {
            gray.close();
        }
        return denoised;
    }
}
