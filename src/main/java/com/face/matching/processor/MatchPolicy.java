package com.face.matching.processor;

import com.face.matching.model.MatchMode;
import com.face.matching.model.MatchRecord;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 匹配策略：阈值判定 + 单张图像是否命中
 * 无副作用
 */
public final class MatchPolicy {

    private final MatchMode mode;
    private final float threshold;

    public MatchPolicy(MatchMode mode, float threshold) {
        if (mode == null) {
            throw new IllegalArgumentException("Match mode must not be null");
        }
        this.mode = mode;
        this.threshold = threshold;
    }

    public static MatchPolicy of(String mode, float threshold) {
        return new MatchPolicy(MatchMode.fromString(mode), threshold);
    }

    public MatchMode getMode() {
        return mode;
    }

    public float getThreshold() {
        return threshold;
    }

    /**
     * 相似度达到阈值（含边界）即产生匹配记录
     */
    public boolean accepts(float score) {
        return score >= threshold;
    }

    /**
     * 判断一张图像是否命中
     *
     * @param records         该图像所有达到阈值的匹配记录
     * @param referenceCount  参考人脸数量
     */
    public boolean qualifies(List<MatchRecord> records, int referenceCount) {
        switch (mode) {
            case INDIVIDUALLY:
                return !records.isEmpty();
            case TOGETHER:
                if (referenceCount <= 0) {
                    return false;
                }
                // 同一个检测框可以同时满足多个参考
                Set<Integer> covered = new HashSet<>();
                for (MatchRecord r : records) {
                    if (r.getReferenceIndex() >= 0 && r.getReferenceIndex() < referenceCount) {
                        covered.add(r.getReferenceIndex());
                    }
                }
                return covered.size() == referenceCount;
            default:
                throw new IllegalStateException("Unhandled match mode: " + mode);
        }
    }

    @Override
    public String toString() {
        return "MatchPolicy(mode=" + mode.getValue() + ", threshold=" + threshold + ")";
    }
}
