package com.face.matching.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.io.Serializable;
import java.util.List;

/**
 * 单张图像的匹配结果（只有满足匹配策略的图像才会生成）
 */
@Value
@Builder
public class ImageResult implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * 原始文件名
     */
    @NonNull
    String filename;

    /**
     * 标注图保存路径，写入失败时为null
     */
    String savedPath;

    /**
     * 匹配记录（保持生成顺序）
     */
    @Singular
    List<MatchRecord> matches;

    /**
     * 最高相似度
     */
    public float getBestScore() {
        float best = 0f;
        boolean found = false;
        for (MatchRecord m : matches) {
            if (!found || m.getScore() > best) {
                best = m.getScore();
                found = true;
            }
        }
        return best;
    }

    /**
     * 第一条匹配的检测框
     */
    public Detection.BoundingBox getPrimaryBox() {
        return matches.isEmpty() ? null : matches.get(0).getBbox();
    }
}
