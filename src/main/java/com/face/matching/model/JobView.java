package com.face.matching.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.io.Serializable;

/**
 * 任务状态快照（只读）
 */
@Value
@Builder(toBuilder = true)
public class JobView implements Serializable {

    private static final long serialVersionUID = 1L;

    @NonNull
    String jobId;

    @NonNull
    JobStatus status;

    /**
     * 完成时的汇总结果
     */
    Summary summary;

    /**
     * 失败原因
     */
    String error;

    /**
     * 标注图输出目录
     */
    String outputDirectory;
}
