package com.face.matching.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.io.Serializable;
import java.util.Optional;

/**
 * 单个人脸检测结果
 */
@Value
@Builder
public class Detection implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * 人脸特征向量
     */
    @NonNull
    FeatureVector embedding;

    /**
     * 边界框坐标
     */
    @NonNull
    BoundingBox bbox;

    @Value
    public static class BoundingBox implements Serializable {
        private static final long serialVersionUID = 1L;

        int x1;  // 左上角x
        int y1;  // 左上角y
        int x2;  // 右下角x
        int y2;  // 右下角y

        @Builder
        public BoundingBox(int x1, int y1, int x2, int y2) {
            if (x1 < 0 || y1 < 0 || x2 <= x1 || y2 <= y1) {
                throw new IllegalArgumentException(String.format(
                        "Invalid bounding box (%d,%d,%d,%d)", x1, y1, x2, y2));
            }
            this.x1 = x1;
            this.y1 = y1;
            this.x2 = x2;
            this.y2 = y2;
        }

        /**
         * 裁剪到图像范围内，裁剪后为空则返回empty
         */
        public static Optional<BoundingBox> clipped(int x1, int y1, int x2, int y2, int width, int height) {
            int cx1 = Math.max(0, x1);
            int cy1 = Math.max(0, y1);
            int cx2 = Math.min(width, x2);
            int cy2 = Math.min(height, y2);
            if (cx2 <= cx1 || cy2 <= cy1) {
                return Optional.empty();
            }
            return Optional.of(new BoundingBox(cx1, cy1, cx2, cy2));
        }

        public Optional<BoundingBox> clip(int width, int height) {
            return clipped(x1, y1, x2, y2, width, height);
        }

        public int width() {
            return x2 - x1;
        }

        public int height() {
            return y2 - y1;
        }
    }
}
