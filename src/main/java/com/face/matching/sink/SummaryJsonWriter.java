package com.face.matching.sink;

import com.face.matching.model.JobView;
import com.face.matching.model.Summary;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 汇总结果JSON输出（字段名为snake_case）
 */
public class SummaryJsonWriter {

    private static final Logger LOG = LoggerFactory.getLogger(SummaryJsonWriter.class);

    public static final String SUMMARY_FILE = "summary.json";

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .enable(SerializationFeature.INDENT_OUTPUT);

    public static String toJson(Summary summary) {
        return writeValue(summary);
    }

    public static String toJson(JobView job) {
        return writeValue(job);
    }

    /**
     * 写入目录下的summary.json
     */
    public static Path write(Summary summary, Path directory) throws IOException {
        Path target = directory.resolve(SUMMARY_FILE);
        Files.createDirectories(directory);
        objectMapper.writeValue(target.toFile(), summary);
        LOG.debug("Summary written: {}", target);
        return target;
    }

    private static String writeValue(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
