package com.face.matching.exception;

import com.face.matching.model.JobStatus;

public class InvalidTransitionException extends RuntimeException {
    public InvalidTransitionException(String jobId, JobStatus from, JobStatus to) {
        super("Job '" + jobId + "' cannot transition from " + from + " to " + to);
    }
}
