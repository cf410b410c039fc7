package com.omr.common.exception;

/**
 * 模板异常（缺少字段定义、模板文件无法解析等）。
 */
public class TemplateException extends OmrException {

    public TemplateException(String message) {
        super("TEMPLATE_ERROR", message);
    }

    public TemplateException(String message, Throwable cause) {
        super("TEMPLATE_ERROR", message, cause);
    }
}
