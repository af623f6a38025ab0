package com.face.matching.util;

import com.face.matching.TestImages;
import com.face.matching.model.Detection;
import com.face.matching.model.MatchRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.opencv.core.Mat;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ImageUtilsTest {

    @TempDir Path tempDir;

    @Test
    void readsWrittenImage() {
        Path file = TestImages.writeSolid(tempDir, "x.png", 77);
        Mat mat = ImageUtils.readImage(file);
        assertNotNull(mat);
        assertEquals(TestImages.WIDTH, mat.cols());
        assertEquals(TestImages.HEIGHT, mat.rows());
        assertEquals(77, TestImages.blueKey(mat));
        mat.release();
    }

    @Test
    void undecodableInputReturnsNull() throws Exception {
        Path garbage = TestImages.writeGarbage(tempDir, "bad.jpg");
        assertNull(ImageUtils.readImage(garbage));
        assertNull(ImageUtils.readImage(tempDir.resolve("missing.png")));
        assertNull(ImageUtils.decodeImage("nope".getBytes(StandardCharsets.UTF_8)));
        assertNull(ImageUtils.decodeImage(new byte[0]));
    }

    @Test
    void decodesEncodedBytes() throws Exception {
        Path file = TestImages.writeSolid(tempDir, "y.png", 12);
        Mat mat = ImageUtils.decodeImage(Files.readAllBytes(file));
        assertNotNull(mat);
        assertEquals(12, TestImages.blueKey(mat));
        mat.release();
    }

    @Test
    void annotateDrawsOnCopyOnly() {
        Mat source = TestImages.solid(50);
        MatchRecord record = MatchRecord.builder()
                .bbox(new Detection.BoundingBox(10, 20, 40, 50))
                .score(0.91f)
                .referenceIndex(0)
                .build();

        Mat annotated = ImageUtils.annotate(source, List.of(record), 2, 0.6);

        double[] edge = annotated.get(35, 10);
        assertArrayEquals(new double[]{0, 255, 0}, edge, 1e-9);
        assertArrayEquals(new double[]{50, 40, 40}, source.get(35, 10), 1e-9);

        source.release();
        annotated.release();
    }

    @Test
    void safeReleaseAcceptsNull() {
        assertDoesNotThrow(() -> ImageUtils.safeRelease(null));
    }
}
