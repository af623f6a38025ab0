package com.face.matching.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.io.Serializable;
import java.util.List;

/**
 * 批处理汇总结果
 */
@Value
@Builder(toBuilder = true)
public class Summary implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String TIMEOUT_MESSAGE = "Processing timed out";

    /**
     * 枚举到的图像总数
     */
    int totalImages;

    /**
     * 成功解码且检测到人脸的图像数
     */
    int processedImages;

    /**
     * 生成结果（满足匹配策略）的图像数
     */
    int matchedImages;

    /**
     * 匹配记录总数
     */
    int totalMatches;

    /**
     * 因解码或检测失败跳过的图像数
     */
    int skippedImages;

    /**
     * 按文件顺序排列的结果
     */
    @Singular
    List<ImageResult> results;

    /**
     * 错误或超时信息，正常完成时为null
     */
    String error;

    /**
     * 超时结果：只保留图像总数
     */
    public static Summary timedOut(int totalImages) {
        return Summary.builder()
                .totalImages(totalImages)
                .error(TIMEOUT_MESSAGE)
                .build();
    }

    public boolean isTimedOut() {
        return TIMEOUT_MESSAGE.equals(error);
    }
}
