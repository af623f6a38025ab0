package com.face.matching.exception;

public class BatchExecutionException extends RuntimeException {
    public BatchExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
