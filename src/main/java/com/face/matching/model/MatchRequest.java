package com.face.matching.model;

import com.face.matching.processor.ProgressListener;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.nio.file.Path;
import java.time.Duration;

/**
 * 一次匹配请求
 */
@Value
@Builder
public class MatchRequest {

    @NonNull
    ReferenceSet referenceSet;

    /**
     * 待检索图像目录
     */
    @NonNull
    Path imageDirectory;

    @Builder.Default
    MatchMode mode = MatchMode.INDIVIDUALLY;

    /**
     * 相似度阈值，为null时使用配置值
     */
    Float threshold;

    /**
     * 超时时间，为null时使用配置值
     */
    Duration deadline;

    /**
     * 进度回调，可为null
     */
    ProgressListener progressListener;

    /**
     * 输出目录，为null时在输出根目录下按任务ID创建
     */
    Path outputDirectory;
}
