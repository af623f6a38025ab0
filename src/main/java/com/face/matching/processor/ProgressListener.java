package com.face.matching.processor;

/**
 * 进度回调，实现必须快速返回
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = percent -> { };

    /**
     * @param percent 0-100
     */
    void onProgress(int percent);
}
