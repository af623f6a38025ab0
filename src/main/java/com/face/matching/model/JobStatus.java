package com.face.matching.model;

/**
 * 任务状态
 */
public enum JobStatus {
    QUEUED,
    RUNNING,
    DONE,
    ERROR;

    /**
     * 是否允许从当前状态迁移到目标状态
     */
    public boolean canTransitionTo(JobStatus target) {
        switch (this) {
            case QUEUED:
                return target == RUNNING;
            case RUNNING:
                return target == DONE || target == ERROR;
            default:
                return false;
        }
    }

    public boolean isTerminal() {
        return this == DONE || this == ERROR;
    }
}
