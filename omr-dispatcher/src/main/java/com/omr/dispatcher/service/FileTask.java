package com.omr.dispatcher.service;

import com.omr.common.dto.FileResult;

import java.nio.file.Path;

/**
 * 单个文件的处理逻辑，由调度器在工作线程中调用。
 */
@FunctionalInterface
public interface FileTask {

    FileResult process(Path file, int inputIndex);
}
