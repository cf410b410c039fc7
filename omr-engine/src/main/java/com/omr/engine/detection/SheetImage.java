package com.omr.engine.detection;

import com.omr.common.dto.BubbleDefinition;

/**
 * 已打开的答题卡图片，可按区域读取平均灰度。用完必须关闭以释放原生内存。
 */
public interface SheetImage extends AutoCloseable {

    /**
     * 区域的平均灰度，范围 [0, 255]。
     */
    double meanIntensity(BubbleDefinition region);

    @Override
    void close();
}
