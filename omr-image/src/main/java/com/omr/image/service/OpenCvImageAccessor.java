package com.omr.image.service;

import com.omr.common.dto.BubbleDefinition;
import com.omr.common.exception.ImageProcessingException;
import com.omr.engine.detection.ImageAccessor;
import com.omr.engine.detection.SheetImage;
import com.omr.image.config.OpenCvProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Rect;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

import static org.bytedeco.opencv.global.opencv_core.mean;

/**
 * 基于 OpenCV 的气泡区域采样：在预处理后的灰度图上计算区域平均灰度。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OpenCvImageAccessor implements ImageAccessor {

    private final ImagePreprocessor preprocessor;
    private final OpenCvProperties properties;

    @Override
    public SheetImage open(Path file) {
        return new OpenCvSheetImage(preprocessor.preprocess(file), properties.getBubbleInset(), file);
    }

    /**
     * 持有一张灰度图，关闭时释放原生内存。只在单个处理任务内使用。
     */
    static class OpenCvSheetImage implements SheetImage {

        private final Mat gray;
        private final int inset;
        private final Path file;

        OpenCvSheetImage(Mat gray, int inset, Path file) {
            this.gray = gray;
            this.inset = inset;
            this.file = file;
        }

        @Override
        public double meanIntensity(BubbleDefinition region) {
            int imgW = gray.cols();
            int imgH = gray.rows();

            // 裁剪到图片范围内，再向内收缩 inset（收缩后过小则不收缩）
            int x = Math.max(0, region.getX());
            int y = Math.max(0, region.getY());
            int w = Math.min(imgW - x, region.getWidth() - (x - region.getX()));
            int h = Math.min(imgH - y, region.getHeight() - (y - region.getY()));
            if (w > 2 * inset && h > 2 * inset) {
                x += inset;
                y += inset;
                w -= 2 * inset;
                h -= 2 * inset;
            }
            if (w <= 0 || h <= 0) {
                throw new ImageProcessingException(String.format(
                        "气泡区域 %s (%d,%d %dx%d) 超出图片范围 %dx%d: %s",
                        region.getLabel(), region.getX(), region.getY(),
                        region.getWidth(), region.getHeight(), imgW, imgH, file));
            }

            try (Rect rect = new Rect(x, y, w, h);
                 Mat roi = new Mat(gray, rect);
                 Scalar m = mean(roi)) {
                return m.get(0);
            }
        }

        @Override
        public void close() {
            gray.close();
        }
    }
}
