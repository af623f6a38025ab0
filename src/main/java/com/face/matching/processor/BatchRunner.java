package com.face.matching.processor;

import com.face.matching.config.MatchingConfig;
import com.face.matching.exception.BatchSetupException;
import com.face.matching.model.Detection;
import com.face.matching.model.FeatureVector;
import com.face.matching.model.ImageResult;
import com.face.matching.model.MatchRecord;
import com.face.matching.model.ReferenceSet;
import com.face.matching.model.Summary;
import com.face.matching.sink.AnnotatedImageSink;
import com.face.matching.util.ImageUtils;
import lombok.extern.slf4j.Slf4j;
import org.opencv.core.Mat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 目录批量匹配
 * 功能：
 * 1. 按文件名字典序枚举目录中的图像
 * 2. 逐张解码、检测人脸、与参考人脸比对
 * 3. 按匹配策略筛选，命中的图像标注后写入输出目录
 * 4. 汇总计数并上报进度
 *
 * 单张图像的失败只计入跳过数，不会中断整个批次
 */
@Slf4j
public class BatchRunner {

    private final FaceDetector detector;
    private final SimilarityMatcher matcher;
    private final Set<String> allowedExtensions;
    private final int annotationThickness;
    private final double annotationFontScale;

    public BatchRunner(FaceDetector detector, SimilarityMatcher matcher, MatchingConfig config) {
        this.detector = detector;
        this.matcher = matcher;
        this.allowedExtensions = new HashSet<>();
        for (String ext : config.getImageExtensions()) {
            allowedExtensions.add(ext.toLowerCase(Locale.ROOT));
        }
        this.annotationThickness = config.getAnnotationThickness();
        this.annotationFontScale = config.getAnnotationFontScale();
    }

    /**
     * 执行一次批量匹配
     *
     * @param directory        待检索图像目录
     * @param referenceSet     参考人脸
     * @param policy           匹配策略（含阈值）
     * @param outputDirectory  标注图输出目录
     * @param listener         进度回调，可为null
     */
    public Summary run(Path directory, ReferenceSet referenceSet, MatchPolicy policy,
                       Path outputDirectory, ProgressListener listener) {
        List<Path> files = listImages(directory);
        List<FeatureVector> references = referenceSet.snapshot();

        AnnotatedImageSink sink = new AnnotatedImageSink(outputDirectory, annotationThickness, annotationFontScale);
        sink.open();

        ProgressListener progress = listener != null ? listener : ProgressListener.NONE;
        int total = files.size();
        int processed = 0;
        int skipped = 0;
        int totalMatches = 0;
        int persisted = 0;
        List<ImageResult> results = new ArrayList<>();

        log.info("Batch started: dir={}, images={}, references={}, {}",
                directory, total, references.size(), policy);
        long startTime = System.currentTimeMillis();

        for (int i = 0; i < total; i++) {
            Path file = files.get(i);
            String filename = file.getFileName().toString();

            Mat image = null;
            try {
                // 1. 解码
                image = ImageUtils.readImage(file);
                if (image == null) {
                    log.warn("Skipping undecodable image: {}", filename);
                    skipped++;
                    continue;
                }

                // 2. 检测 + 比对
                List<MatchRecord> records;
                try {
                    List<Detection> detections = clipToImage(detector.detect(image), image);
                    if (detections.isEmpty()) {
                        log.debug("No faces detected in {}", filename);
                        skipped++;
                        continue;
                    }
                    records = collectMatches(references, detections, policy);
                } catch (Exception e) {
                    log.warn("Skipping image {} after detection failure: {}", filename, e.getMessage());
                    skipped++;
                    continue;
                }
                processed++;

                // 3. 策略判定，命中则标注保存
                if (policy.qualifies(records, references.size())) {
                    String savedPath = sink.save(filename, image, records);
                    if (savedPath != null) {
                        persisted++;
                    }
                    results.add(ImageResult.builder()
                            .filename(filename)
                            .savedPath(savedPath)
                            .matches(records)
                            .build());
                    totalMatches += records.size();
                    log.debug("Image matched: {}, records={}", filename, records.size());
                }
            } finally {
                ImageUtils.safeRelease(image);
                reportProgress(progress, i + 1, total);
            }
        }

        long duration = System.currentTimeMillis() - startTime;
        log.info("Batch finished in {} ms: total={}, processed={}, matched={}, saved={}, skipped={}",
                duration, total, processed, results.size(), persisted, skipped);

        return Summary.builder()
                .totalImages(total)
                .processedImages(processed)
                .matchedImages(persisted)
                .totalMatches(totalMatches)
                .skippedImages(skipped)
                .results(results)
                .build();
    }

    /**
     * 检测框裁剪到图像范围，完全落在图像外的检测丢弃
     */
    private List<Detection> clipToImage(List<Detection> detections, Mat image) {
        List<Detection> clipped = new ArrayList<>();
        if (detections == null) {
            return clipped;
        }
        for (Detection detection : detections) {
            Optional<Detection.BoundingBox> box = detection.getBbox().clip(image.cols(), image.rows());
            if (box.isPresent()) {
                clipped.add(box.get().equals(detection.getBbox())
                        ? detection
                        : Detection.builder().embedding(detection.getEmbedding()).bbox(box.get()).build());
            } else {
                log.debug("Dropping detection outside image bounds: {}", detection.getBbox());
            }
        }
        return clipped;
    }

    /**
     * 按参考索引在外、检测框在内的顺序生成匹配记录
     */
    private List<MatchRecord> collectMatches(List<FeatureVector> references, List<Detection> detections,
                                             MatchPolicy policy) {
        List<MatchRecord> records = new ArrayList<>();
        for (int refIdx = 0; refIdx < references.size(); refIdx++) {
            FeatureVector reference = references.get(refIdx);
            for (Detection detection : detections) {
                float score = matcher.similarity(reference, detection.getEmbedding());
                if (policy.accepts(score)) {
                    records.add(MatchRecord.builder()
                            .bbox(detection.getBbox())
                            .score(score)
                            .referenceIndex(refIdx)
                            .build());
                }
            }
        }
        return records;
    }

    private void reportProgress(ProgressListener listener, int done, int total) {
        int percent = (int) ((long) done * 100 / total);
        try {
            listener.onProgress(percent);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed at {}%: {}", percent, e.getMessage());
        }
    }

    /**
     * 统计目录中的图像数量
     */
    public int countImages(Path directory) {
        return listImages(directory).size();
    }

    /**
     * 枚举目录中符合扩展名的图像文件（不递归），按文件名排序
     */
    public List<Path> listImages(Path directory) {
        if (directory == null || !Files.isDirectory(directory)) {
            throw new BatchSetupException("Image directory does not exist: " + directory);
        }
        if (!Files.isReadable(directory)) {
            throw new BatchSetupException("Image directory is not readable: " + directory);
        }
        try (Stream<Path> stream = Files.list(directory)) {
            return stream
                    .filter(Files::isRegularFile)
                    .filter(this::hasAllowedExtension)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new BatchSetupException("Failed to list image directory: " + directory, e);
        }
    }

    private boolean hasAllowedExtension(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return false;
        }
        return allowedExtensions.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }
}
