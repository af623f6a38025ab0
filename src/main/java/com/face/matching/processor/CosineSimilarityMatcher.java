package com.face.matching.processor;

import com.face.matching.model.FeatureVector;

/**
 * 余弦相似度，范围[-1,1]，1表示同一个人
 */
public class CosineSimilarityMatcher implements SimilarityMatcher {

    @Override
    public float similarity(FeatureVector reference, FeatureVector candidate) {
        if (reference == null || candidate == null || reference.isEmpty() || candidate.isEmpty()) {
            return -1.0f;
        }
        // 两侧都已归一化，点积即余弦
        double dot = reference.dot(candidate);
        return (float) Math.max(-1.0, Math.min(1.0, dot));
    }
}
