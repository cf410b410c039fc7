package com.omr.common.exception;

/**
 * 批次启动前的契约校验失败（并发数非法、文件列表为空引用等），在派发任何文件前抛出。
 */
public class BatchContractException extends OmrException {

    public BatchContractException(String message) {
        super("BATCH_ERROR", message);
    }
}
