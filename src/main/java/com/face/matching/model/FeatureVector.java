package com.face.matching.model;

import java.io.Serializable;
import java.util.Arrays;

/**
 * 人脸特征向量（embedding）
 * 创建时做L2归一化，之后不可变
 */
public final class FeatureVector implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * 模长低于该值时不做归一化
     */
    private static final double NORM_EPSILON = 1e-10;

    private final float[] values;

    private FeatureVector(float[] values) {
        this.values = values;
    }

    /**
     * 由原始特征值创建（会拷贝并归一化）
     */
    public static FeatureVector of(float... raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Feature values must not be null");
        }
        return new FeatureVector(normalize(raw));
    }

    public static FeatureVector of(double... raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Feature values must not be null");
        }
        float[] copy = new float[raw.length];
        for (int i = 0; i < raw.length; i++) {
            copy[i] = (float) raw[i];
        }
        return of(copy);
    }

    /**
     * L2归一化，返回新数组
     */
    public static float[] normalize(float[] raw) {
        double sum = 0;
        for (float v : raw) {
            sum += (double) v * v;
        }
        double norm = Math.sqrt(sum);
        float[] result = Arrays.copyOf(raw, raw.length);
        if (norm < NORM_EPSILON) {
            return result;
        }
        for (int i = 0; i < result.length; i++) {
            result[i] = (float) (result[i] / norm);
        }
        return result;
    }

    public int dimension() {
        return values.length;
    }

    public boolean isEmpty() {
        return values.length == 0;
    }

    public float get(int i) {
        return values[i];
    }

    /**
     * 返回特征值拷贝
     */
    public float[] toArray() {
        return Arrays.copyOf(values, values.length);
    }

    /**
     * 点积（两个向量维度必须一致）
     */
    public double dot(FeatureVector other) {
        if (other.values.length != values.length) {
            throw new IllegalArgumentException("Dimension mismatch: "
                    + values.length + " vs " + other.values.length);
        }
        double sum = 0;
        for (int i = 0; i < values.length; i++) {
            sum += (double) values[i] * other.values[i];
        }
        return sum;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureVector)) return false;
        return Arrays.equals(values, ((FeatureVector) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "FeatureVector(dim=" + values.length + ")";
    }
}
