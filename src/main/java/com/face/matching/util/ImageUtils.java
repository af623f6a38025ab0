package com.face.matching.util;

import com.face.matching.model.Detection;
import com.face.matching.model.MatchRecord;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * 图像处理工具类
 */
public class ImageUtils {

    private static final Logger LOG = LoggerFactory.getLogger(ImageUtils.class);

    /**
     * 标注颜色（BGR绿色）
     */
    public static final Scalar ANNOTATION_COLOR = new Scalar(0, 255, 0);

    private static volatile boolean loaded;

    static {
        loadLibrary();
    }

    /**
     * 加载OpenCV本地库（可重复调用）
     */
    public static synchronized void loadLibrary() {
        if (loaded) {
            return;
        }
        try {
            nu.pattern.OpenCV.loadLocally();
            loaded = true;
            LOG.info("OpenCV loaded successfully");
        } catch (Exception | LinkageError e) {
            LOG.error("Failed to load OpenCV", e);
        }
    }

    /**
     * 读取图像文件，解码失败返回null
     */
    public static Mat readImage(Path file) {
        Mat mat = Imgcodecs.imread(file.toString(), Imgcodecs.IMREAD_COLOR);
        if (mat == null || mat.empty()) {
            safeRelease(mat);
            return null;
        }
        return mat;
    }

    /**
     * 解码图像字节数组为Mat对象，解码失败返回null
     */
    public static Mat decodeImage(byte[] imageData) {
        if (imageData == null || imageData.length == 0) {
            return null;
        }
        MatOfByte matOfByte = new MatOfByte(imageData);
        Mat mat = Imgcodecs.imdecode(matOfByte, Imgcodecs.IMREAD_COLOR);
        matOfByte.release();
        if (mat == null || mat.empty()) {
            safeRelease(mat);
            return null;
        }
        return mat;
    }

    /**
     * 在图像副本上绘制检测框和相似度，原图不变
     */
    public static Mat annotate(Mat image, List<MatchRecord> records, int thickness, double fontScale) {
        Mat copy = image.clone();
        for (MatchRecord record : records) {
            Detection.BoundingBox box = record.getBbox();
            Imgproc.rectangle(copy,
                    new Point(box.getX1(), box.getY1()),
                    new Point(box.getX2(), box.getY2()),
                    ANNOTATION_COLOR, thickness);
            Imgproc.putText(copy,
                    String.format(Locale.ROOT, "%.2f", record.getScore()),
                    new Point(box.getX1(), Math.max(10, box.getY1() - 10)),
                    Imgproc.FONT_HERSHEY_SIMPLEX, fontScale, ANNOTATION_COLOR, thickness);
        }
        return copy;
    }

    /**
     * 写出图像，格式由扩展名决定
     */
    public static boolean writeImage(Path file, Mat image) {
        return Imgcodecs.imwrite(file.toString(), image);
    }

    /**
     * 安全释放Mat
     */
    public static void safeRelease(Mat mat) {
        if (mat != null) {
            try {
                mat.release();
            } catch (Exception e) {
                LOG.error("Error releasing Mat", e);
            }
        }
    }
}
