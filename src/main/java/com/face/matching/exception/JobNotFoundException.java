package com.face.matching.exception;

public class JobNotFoundException extends RuntimeException {
    public JobNotFoundException(String jobId) {
        super("Job with ID '" + jobId + "' was not found.");
    }
}
