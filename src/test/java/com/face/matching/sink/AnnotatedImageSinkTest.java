package com.face.matching.sink;

import com.face.matching.TestImages;
import com.face.matching.exception.BatchSetupException;
import com.face.matching.model.Detection;
import com.face.matching.model.MatchRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.opencv.core.Mat;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnnotatedImageSinkTest {

    @TempDir Path tempDir;

    private final List<MatchRecord> records = List.of(MatchRecord.builder()
            .bbox(new Detection.BoundingBox(2, 2, 20, 20)).score(0.8f).referenceIndex(0).build());

    @Test
    void createsOutputDirectoryAndSavesUnderOriginalName() {
        Path out = tempDir.resolve("nested/out");
        AnnotatedImageSink sink = new AnnotatedImageSink(out, 2, 0.6);
        sink.open();
        assertTrue(Files.isDirectory(out));

        Mat image = TestImages.solid(5);
        String saved = sink.save("photo.png", image, records);
        image.release();

        assertEquals(out.resolve("photo.png").toString(), saved);
        assertTrue(Files.exists(out.resolve("photo.png")));
    }

    @Test
    void unwritableTargetReturnsNull() {
        AnnotatedImageSink sink = new AnnotatedImageSink(tempDir, 2, 0.6);
        sink.open();
        Mat image = TestImages.solid(5);
        // 未知扩展名，编码器无法写出
        String saved;
        try {
            saved = sink.save("photo.unknownext", image, records);
        } finally {
            image.release();
        }
        assertNull(saved);
    }

    @Test
    void openFailsWhenOutputPathIsAFile() throws Exception {
        Path file = Files.createFile(tempDir.resolve("taken"));
        AnnotatedImageSink sink = new AnnotatedImageSink(file.resolve("sub"), 2, 0.6);
        assertThrows(BatchSetupException.class, sink::open);
    }
}
