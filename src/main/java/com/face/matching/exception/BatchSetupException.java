package com.face.matching.exception;

/**
 * 批处理启动前的I/O错误（目录不存在、不可读、输出目录无法创建）
 */
public class BatchSetupException extends RuntimeException {
    public BatchSetupException(String message) {
        super(message);
    }

    public BatchSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
