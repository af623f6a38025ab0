package com.face.matching.processor;

import com.face.matching.model.Detection;
import org.opencv.core.Mat;

import java.util.List;

/**
 * 人脸检测 + 特征提取
 * 特征向量应已归一化；检测框由调用方裁剪到图像范围内
 */
public interface FaceDetector {

    /**
     * @param image BGR图像
     * @return 检测到的人脸，没有则返回空列表
     */
    List<Detection> detect(Mat image) throws Exception;
}
