package com.face.matching.sink;

import com.face.matching.model.Detection;
import com.face.matching.model.ImageResult;
import com.face.matching.model.JobStatus;
import com.face.matching.model.JobView;
import com.face.matching.model.MatchRecord;
import com.face.matching.model.Summary;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SummaryJsonWriterTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir Path tempDir;

    private final Summary summary = Summary.builder()
            .totalImages(3)
            .processedImages(2)
            .matchedImages(1)
            .totalMatches(1)
            .skippedImages(1)
            .result(ImageResult.builder()
                    .filename("a.png")
                    .savedPath("/out/a.png")
                    .match(MatchRecord.builder()
                            .bbox(new Detection.BoundingBox(1, 2, 3, 4))
                            .score(0.82f)
                            .referenceIndex(0)
                            .build())
                    .build())
            .build();

    @Test
    void summaryUsesSnakeCase() throws Exception {
        JsonNode json = MAPPER.readTree(SummaryJsonWriter.toJson(summary));

        assertEquals(3, json.get("total_images").asInt());
        assertEquals(1, json.get("skipped_images").asInt());
        assertEquals(2, json.get("processed_images").asInt());
        assertTrue(json.get("error").isNull());

        JsonNode result = json.get("results").get(0);
        assertEquals("a.png", result.get("filename").asText());
        assertEquals("/out/a.png", result.get("saved_path").asText());
        JsonNode match = result.get("matches").get(0);
        assertEquals(0, match.get("reference_index").asInt());
        assertEquals(4, match.get("bbox").get("y2").asInt());
    }

    @Test
    void jobViewIncludesStatus() throws Exception {
        JobView view = JobView.builder().jobId("abc").status(JobStatus.ERROR)
                .error(Summary.TIMEOUT_MESSAGE).build();
        JsonNode json = MAPPER.readTree(SummaryJsonWriter.toJson(view));
        assertEquals("abc", json.get("job_id").asText());
        assertEquals("ERROR", json.get("status").asText());
        assertEquals("Processing timed out", json.get("error").asText());
    }

    @Test
    void writesSummaryFile() throws Exception {
        Path file = SummaryJsonWriter.write(summary, tempDir.resolve("job"));
        assertEquals(SummaryJsonWriter.SUMMARY_FILE, file.getFileName().toString());
        JsonNode json = MAPPER.readTree(Files.readString(file));
        assertEquals(1, json.get("matched_images").asInt());
    }
}
