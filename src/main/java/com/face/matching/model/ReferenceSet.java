package com.face.matching.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 参考人脸集合
 * 只允许追加，索引在追加时分配（0..N-1），之后不再变化也不会复用
 */
public class ReferenceSet {

    private final List<FeatureVector> vectors = new ArrayList<>();

    public ReferenceSet() {
    }

    public static ReferenceSet of(List<FeatureVector> vectors) {
        ReferenceSet set = new ReferenceSet();
        vectors.forEach(set::append);
        return set;
    }

    public static ReferenceSet of(FeatureVector... vectors) {
        ReferenceSet set = new ReferenceSet();
        for (FeatureVector v : vectors) {
            set.append(v);
        }
        return set;
    }

    /**
     * 从参考图像的检测结果中按用户选择的序号构建
     *
     * @param detections       参考图像检测出的人脸
     * @param selectedIndices  用户选中的人脸序号
     */
    public static ReferenceSet fromSelection(List<Detection> detections, List<Integer> selectedIndices) {
        ReferenceSet set = new ReferenceSet();
        for (Integer idx : selectedIndices) {
            if (idx == null || idx < 0 || idx >= detections.size()) {
                throw new IllegalArgumentException("Invalid face index: " + idx);
            }
            set.append(detections.get(idx).getEmbedding());
        }
        return set;
    }

    /**
     * 追加参考向量，返回分配的索引
     */
    public synchronized int append(FeatureVector vector) {
        if (vector == null) {
            throw new IllegalArgumentException("Reference vector must not be null");
        }
        vectors.add(vector);
        return vectors.size() - 1;
    }

    public synchronized FeatureVector get(int index) {
        return vectors.get(index);
    }

    public synchronized int size() {
        return vectors.size();
    }

    public synchronized boolean isEmpty() {
        return vectors.isEmpty();
    }

    /**
     * 不可变快照，列表下标即参考索引
     */
    public synchronized List<FeatureVector> snapshot() {
        return Collections.unmodifiableList(new ArrayList<>(vectors));
    }
}
