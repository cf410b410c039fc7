package com.omr.engine.detection;

import java.nio.file.Path;

/**
 * 外部图像能力：打开一张答题卡图片。
 * 图片无法读取时抛出 {@link com.omr.common.exception.ImageProcessingException}。
 */
public interface ImageAccessor {

    SheetImage open(Path file);
}
