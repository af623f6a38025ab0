package com.face.matching.processor;

import com.face.matching.model.FeatureVector;

/**
 * 特征相似度，值越大越相似
 */
@FunctionalInterface
public interface SimilarityMatcher {

    float similarity(FeatureVector reference, FeatureVector candidate);
}
