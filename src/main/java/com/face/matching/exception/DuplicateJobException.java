package com.face.matching.exception;

public class DuplicateJobException extends RuntimeException {
    public DuplicateJobException(String jobId) {
        super("Job with id already exists: " + jobId);
    }
}
