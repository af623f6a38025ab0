package com.face.matching.config;

import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Properties;

/**
 * 人脸匹配引擎配置类
 */
@Data
public class MatchingConfig implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(MatchingConfig.class);

    public static final String DEFAULT_RESOURCE = "application.properties";

    // 图像扫描配置
    private List<String> imageExtensions = new ArrayList<>(Arrays.asList("jpg", "jpeg", "png"));

    // 匹配配置
    private float similarityThreshold = 0.7f;
    private long deadlineSeconds = 0; // 0表示不限时

    // 输出配置
    private String outputRoot = "output";
    private boolean writeSummary = true;
    private long outputRetentionSeconds = 3600;

    // 标注配置
    private int annotationThickness = 2;
    private double annotationFontScale = 0.6;

    // 异步任务配置
    private int jobWorkers = 2;

    /**
     * 从默认配置文件加载配置
     */
    public static MatchingConfig loadConfig() {
        return loadConfig(DEFAULT_RESOURCE);
    }

    /**
     * 从classpath下指定配置文件加载配置
     */
    public static MatchingConfig loadConfig(String resource) {
        MatchingConfig config = new MatchingConfig();
        Properties props = new Properties();

        try (InputStream input = MatchingConfig.class.getClassLoader()
                .getResourceAsStream(resource)) {
            if (input == null) {
                LOG.warn("Configuration file '{}' not found in classpath, using defaults", resource);
                return config;
            }

            props.load(input);
            config.apply(props);

            LOG.info("Configuration loaded successfully from {}", resource);
            LOG.info("Image extensions: {}, threshold: {}, deadline: {}s",
                    config.getImageExtensions(), config.getSimilarityThreshold(), config.getDeadlineSeconds());
            LOG.info("Output root: {}, job workers: {}", config.getOutputRoot(), config.getJobWorkers());

        } catch (Exception e) {
            LOG.error("Error loading configuration", e);
            throw new RuntimeException("Failed to load configuration", e);
        }

        return config;
    }

    /**
     * 用Properties覆盖默认值
     */
    public void apply(Properties props) {
        // 加载扫描配置
        String extensions = props.getProperty("matching.image.extensions");
        if (extensions != null) {
            setImageExtensions(parseExtensions(extensions));
        }

        // 加载匹配配置
        setSimilarityThreshold(Float.parseFloat(props.getProperty(
                "matching.similarity.threshold", String.valueOf(similarityThreshold))));
        setDeadlineSeconds(Long.parseLong(props.getProperty(
                "matching.deadline.seconds", String.valueOf(deadlineSeconds))));

        // 加载输出配置
        setOutputRoot(props.getProperty("matching.output.root", outputRoot));
        setWriteSummary(Boolean.parseBoolean(props.getProperty(
                "matching.summary.write", String.valueOf(writeSummary))));
        setOutputRetentionSeconds(Long.parseLong(props.getProperty(
                "matching.output.retention.seconds", String.valueOf(outputRetentionSeconds))));

        // 加载标注配置
        setAnnotationThickness(Integer.parseInt(props.getProperty(
                "matching.annotation.thickness", String.valueOf(annotationThickness))));
        setAnnotationFontScale(Double.parseDouble(props.getProperty(
                "matching.annotation.font.scale", String.valueOf(annotationFontScale))));

        // 加载任务配置
        int workers = Integer.parseInt(props.getProperty(
                "matching.job.workers", String.valueOf(jobWorkers)));
        if (workers < 1) {
            throw new IllegalArgumentException("matching.job.workers must be >= 1, got " + workers);
        }
        setJobWorkers(workers);
    }

    /**
     * 默认超时时间，未配置时返回null
     */
    public Duration getDefaultDeadline() {
        return deadlineSeconds > 0 ? Duration.ofSeconds(deadlineSeconds) : null;
    }

    private static List<String> parseExtensions(String value) {
        List<String> result = new ArrayList<>();
        for (String ext : value.split(",")) {
            String e = ext.trim().toLowerCase(Locale.ROOT);
            if (e.startsWith(".")) {
                e = e.substring(1);
            }
            if (!e.isEmpty()) {
                result.add(e);
            }
        }
        return result;
    }
}
