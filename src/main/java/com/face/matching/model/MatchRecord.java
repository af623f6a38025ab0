package com.face.matching.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.io.Serializable;

/**
 * 一次达到阈值的匹配：检测框 + 相似度 + 参考索引
 */
@Value
@Builder
public class MatchRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    @NonNull
    Detection.BoundingBox bbox;

    float score;

    int referenceIndex;
}
