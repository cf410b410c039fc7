package com.omr.common.exception;

import java.nio.file.Path;

/**
 * 答题卡图片无法使用：文件读不出、解码失败、气泡区域落在图片外。
 * 对应文件按失败处理，不重试。
 */
public class ImageProcessingException extends OmrException {

    public static final String CODE = "IMG_ERROR";

    public ImageProcessingException(String message) {
        super(CODE, message);
    }

    public ImageProcessingException(String message, Throwable cause) {
        super(CODE, message, cause);
    }

    /**
     * 图片文件读取或解码失败。
     */
    public static ImageProcessingException unreadable(Path file, String reason, Throwable cause) {
        return new ImageProcessingException(reason + ": " + file, cause);
    }
}
