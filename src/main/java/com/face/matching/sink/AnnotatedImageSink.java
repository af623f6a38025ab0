package com.face.matching.sink;

import com.face.matching.exception.BatchSetupException;
import com.face.matching.model.MatchRecord;
import com.face.matching.util.ImageUtils;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 标注图输出Sink
 * 在原图副本上绘制匹配框后，按原文件名写入输出目录
 */
public class AnnotatedImageSink {

    private static final Logger LOG = LoggerFactory.getLogger(AnnotatedImageSink.class);

    private final Path outputDirectory;
    private final int thickness;
    private final double fontScale;

    public AnnotatedImageSink(Path outputDirectory, int thickness, double fontScale) {
        this.outputDirectory = outputDirectory;
        this.thickness = thickness;
        this.fontScale = fontScale;
    }

    /**
     * 确保输出目录存在
     */
    public void open() {
        try {
            Files.createDirectories(outputDirectory);
        } catch (IOException e) {
            throw new BatchSetupException("Cannot create output directory: " + outputDirectory, e);
        }
        LOG.debug("Annotated image sink opened: {}", outputDirectory);
    }

    /**
     * 标注并保存
     *
     * @return 保存路径，写入失败返回null
     */
    public String save(String filename, Mat image, List<MatchRecord> records) {
        Path target = outputDirectory.resolve(filename);
        Mat annotated = null;
        try {
            annotated = ImageUtils.annotate(image, records, thickness, fontScale);
            if (!ImageUtils.writeImage(target, annotated)) {
                LOG.warn("Failed to write annotated image: {}", target);
                return null;
            }
            LOG.debug("Annotated image saved: {}, boxes={}", target, records.size());
            return target.toString();
        } catch (Exception e) {
            LOG.error("Error saving annotated image {}", target, e);
            return null;
        } finally {
            ImageUtils.safeRelease(annotated);
        }
    }

    public Path getOutputDirectory() {
        return outputDirectory;
    }
}
