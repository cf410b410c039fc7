package com.omr.dispatcher.sink;

import com.omr.common.dto.FileResult;

/**
 * 结果输出端（如追加一行到结果表）。
 * 调度器保证调用顺序与 inputIndex 顺序一致，且同一时刻只有一个线程在调用。
 */
public interface ResultSink {

    /** 输出一条成功结果 */
    void write(FileResult result);

    /** 输出一条失败诊断（文件路径 + 原因），默认忽略 */
    default void writeError(FileResult result) {
    }
}
