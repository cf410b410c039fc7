package com.omr.common.util;

import java.nio.file.Path;
import java.util.Set;

/**
 * 图片文件工具类。
 */
public final class ImageUtils {

    private static final Set<String> SUPPORTED_EXTENSIONS = Set.of(
            ".png", ".jpg", ".jpeg", ".bmp", ".tif", ".tiff", ".webp");

    private ImageUtils() {
    }

    /**
     * 根据文件扩展名判断是否为可识别的答题卡图片。
     */
    public static boolean isImageFile(Path path) {
        if (path == null || path.getFileName() == null) return false;
        String lower = path.getFileName().toString().toLowerCase();
        int dot = lower.lastIndexOf('.');
        if (dot < 0) return false;
        return SUPPORTED_EXTENSIONS.contains(lower.substring(dot));
    }

    /**
     * 将灰度值限制在 0-255 范围内。
     */
    public static double clampIntensity(double value) {
        if (value < 0) return 0;
        return Math.min(value, 255);
    }
}
