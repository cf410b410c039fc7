package com.omr.common.exception;

/**
 * 识别流程的基础异常，携带错误码。
 * <p>
 * 单个文件内抛出的异常由文件处理器转为失败结果，不会中断批次；
 * 批次级异常（模板、输入目录、输出文件）直接向上抛出。
 */
public class OmrException extends RuntimeException {

    /** 输入目录不存在或无法遍历 */
    public static final String INPUT_ERROR = "INPUT_ERROR";

    /** 结果文件无法创建或写入 */
    public static final String OUTPUT_ERROR = "OUTPUT_ERROR";

    private final String errorCode;

    public OmrException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public OmrException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + errorCode + "]: " + getMessage();
    }
}
