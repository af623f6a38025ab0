package com.face.matching;

import com.face.matching.config.MatchingConfig;
import com.face.matching.job.JobRegistry;
import com.face.matching.model.Detection;
import com.face.matching.model.JobView;
import com.face.matching.model.MatchRequest;
import com.face.matching.model.Summary;
import com.face.matching.processor.BatchRunner;
import com.face.matching.processor.CosineSimilarityMatcher;
import com.face.matching.processor.FaceDetector;
import com.face.matching.processor.MatchPolicy;
import com.face.matching.processor.SimilarityMatcher;
import com.face.matching.processor.TimeBoundedExecutor;
import com.face.matching.sink.OutputCleaner;
import com.face.matching.sink.SummaryJsonWriter;
import com.face.matching.util.ImageUtils;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 人脸匹配服务入口
 * 功能：
 * 1. 从参考图像中提取人脸
 * 2. 同步执行目录匹配（调用方阻塞到结束或超时）
 * 3. 异步提交匹配任务，按任务ID轮询状态
 * 4. 清理过期的输出目录
 */
public class FaceMatchingService implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(FaceMatchingService.class);

    private final MatchingConfig config;
    private final FaceDetector detector;
    private final BatchRunner batchRunner;
    private final TimeBoundedExecutor timeBoundedExecutor;
    private final JobRegistry jobRegistry;
    private final ExecutorService jobPool;
    private final Path outputRoot;

    private final AtomicLong jobThreadCounter = new AtomicLong(0);

    public FaceMatchingService(MatchingConfig config, FaceDetector detector) {
        this(config, detector, new CosineSimilarityMatcher(), new JobRegistry());
    }

    public FaceMatchingService(MatchingConfig config, FaceDetector detector,
                               SimilarityMatcher matcher, JobRegistry jobRegistry) {
        this.config = config;
        this.detector = detector;
        this.batchRunner = new BatchRunner(detector, matcher, config);
        this.timeBoundedExecutor = new TimeBoundedExecutor();
        this.jobRegistry = jobRegistry;
        this.outputRoot = Paths.get(config.getOutputRoot()).toAbsolutePath().normalize();
        this.jobPool = Executors.newFixedThreadPool(config.getJobWorkers(), runnable -> {
            Thread t = new Thread(runnable, "match-job-" + jobThreadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        LOG.info("FaceMatchingService initialized: outputRoot={}, workers={}",
                outputRoot, config.getJobWorkers());
    }

    /**
     * 检测参考图像中的人脸，返回顺序即可供选择的人脸序号
     */
    public List<Detection> extractReferenceFaces(Path referenceImage) {
        return extractReferenceFaces(ImageUtils.readImage(referenceImage));
    }

    public List<Detection> extractReferenceFaces(byte[] imageData) {
        return extractReferenceFaces(ImageUtils.decodeImage(imageData));
    }

    private List<Detection> extractReferenceFaces(Mat image) {
        if (image == null) {
            throw new IllegalArgumentException("Cannot decode reference image");
        }
        try {
            List<Detection> faces = detector.detect(image);
            LOG.info("Reference image: {} faces detected", faces.size());
            return faces;
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Reference face detection failed", e);
        } finally {
            ImageUtils.safeRelease(image);
        }
    }

    /**
     * 同步执行：阻塞直到批处理结束或超时
     * 超时返回带error的Summary；启动失败的异常直接抛给调用方
     */
    public Summary run(MatchRequest request) {
        cleanupExpiredOutputs();
        String jobId = newJobId();
        Path outputDirectory = resolveOutputDirectory(request, jobId);
        jobRegistry.create(jobId, outputDirectory.toString());
        return execute(jobId, request, outputDirectory, true);
    }

    /**
     * 异步提交，立即返回任务ID
     */
    public String submit(MatchRequest request) {
        if (jobPool.isShutdown()) {
            throw new IllegalStateException("FaceMatchingService is closed");
        }
        cleanupExpiredOutputs();
        String jobId = newJobId();
        Path outputDirectory = resolveOutputDirectory(request, jobId);
        jobRegistry.create(jobId, outputDirectory.toString());
        jobPool.submit(() -> execute(jobId, request, outputDirectory, false));
        LOG.info("Job {} queued: dir={}, mode={}", jobId, request.getImageDirectory(), request.getMode().getValue());
        return jobId;
    }

    /**
     * 查询任务状态
     */
    public JobView getJob(String jobId) {
        return jobRegistry.get(jobId);
    }

    public String getJobJson(String jobId) {
        return SummaryJsonWriter.toJson(jobRegistry.get(jobId));
    }

    /**
     * 清理输出根目录下过期且不属于运行中任务的目录
     * 目录被删除的已结束任务同时从任务表移除，避免返回失效的savedPath
     */
    public int cleanupExpiredOutputs() {
        if (config.getOutputRetentionSeconds() <= 0) {
            return 0;
        }
        Set<String> active = jobRegistry.activeOutputDirectories();
        return OutputCleaner.cleanupOlderThan(outputRoot,
                Duration.ofSeconds(config.getOutputRetentionSeconds()),
                dir -> active.contains(dir.toString()),
                dir -> jobRegistry.evictFinished(dir.toString()));
    }

    private Summary execute(String jobId, MatchRequest request, Path outputDirectory, boolean rethrow) {
        jobRegistry.markRunning(jobId);

        float threshold = request.getThreshold() != null
                ? request.getThreshold() : config.getSimilarityThreshold();
        MatchPolicy policy = new MatchPolicy(request.getMode(), threshold);
        Duration deadline = request.getDeadline() != null
                ? request.getDeadline() : config.getDefaultDeadline();
        Path imageDirectory = request.getImageDirectory();

        try {
            Summary summary = timeBoundedExecutor.runWithDeadline(
                    () -> batchRunner.run(imageDirectory, request.getReferenceSet(), policy,
                            outputDirectory, request.getProgressListener()),
                    deadline,
                    () -> batchRunner.countImages(imageDirectory));

            if (summary.isTimedOut()) {
                LOG.warn("Job {} timed out after {}", jobId, deadline);
                jobRegistry.markError(jobId, summary.getError());
            } else {
                writeSummary(jobId, summary, outputDirectory);
                jobRegistry.markDone(jobId, summary);
                LOG.info("Job {} done: matched={}/{}", jobId, summary.getMatchedImages(), summary.getTotalImages());
            }
            return summary;

        } catch (RuntimeException | Error e) {
            // 任务必须进入终态，否则轮询方会一直看到RUNNING
            LOG.error("Job {} failed", jobId, e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            jobRegistry.markError(jobId, message);
            if (rethrow) {
                throw e;
            }
            return null;
        }
    }

    private void writeSummary(String jobId, Summary summary, Path outputDirectory) {
        if (!config.isWriteSummary()) {
            return;
        }
        try {
            SummaryJsonWriter.write(summary, outputDirectory);
        } catch (IOException e) {
            LOG.warn("Failed to write summary for job {}: {}", jobId, e.getMessage());
        }
    }

    private Path resolveOutputDirectory(MatchRequest request, String jobId) {
        if (request.getOutputDirectory() != null) {
            return request.getOutputDirectory().toAbsolutePath().normalize();
        }
        return outputRoot.resolve(jobId);
    }

    private static String newJobId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    public JobRegistry getJobRegistry() {
        return jobRegistry;
    }

    @Override
    public void close() {
        jobPool.shutdown();
        LOG.info("FaceMatchingService closed");
    }
}
