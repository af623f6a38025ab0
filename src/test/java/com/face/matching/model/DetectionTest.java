package com.face.matching.model;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DetectionTest {

    @Test
    void boundingBoxRejectsInvalidCoordinates() {
        assertThrows(IllegalArgumentException.class, () -> new Detection.BoundingBox(-1, 0, 5, 5));
        assertThrows(IllegalArgumentException.class, () -> new Detection.BoundingBox(5, 0, 5, 5));
        assertThrows(IllegalArgumentException.class, () -> new Detection.BoundingBox(0, 6, 5, 5));
    }

    @Test
    void clipsToImageBounds() {
        Optional<Detection.BoundingBox> box = Detection.BoundingBox.clipped(-5, -3, 120, 40, 100, 50);
        assertTrue(box.isPresent());
        assertEquals(new Detection.BoundingBox(0, 0, 100, 40), box.get());
        assertEquals(100, box.get().width());
        assertEquals(40, box.get().height());
    }

    @Test
    void clipOutsideImageIsEmpty() {
        Detection.BoundingBox box = new Detection.BoundingBox(80, 80, 90, 90);
        assertFalse(box.clip(50, 50).isPresent());
    }

    @Test
    void summaryTimeoutFactory() {
        Summary summary = Summary.timedOut(4);
        assertTrue(summary.isTimedOut());
        assertEquals(4, summary.getTotalImages());
        assertEquals(0, summary.getProcessedImages());
        assertTrue(summary.getResults().isEmpty());
        assertFalse(Summary.builder().totalImages(1).build().isTimedOut());
    }

    @Test
    void imageResultBestScoreAndPrimaryBox() {
        Detection.BoundingBox first = new Detection.BoundingBox(0, 0, 10, 10);
        ImageResult result = ImageResult.builder()
                .filename("a.png")
                .match(MatchRecord.builder().bbox(first).score(0.71f).referenceIndex(0).build())
                .match(MatchRecord.builder().bbox(new Detection.BoundingBox(20, 20, 30, 30))
                        .score(0.93f).referenceIndex(1).build())
                .build();

        assertEquals(0.93f, result.getBestScore(), 1e-6);
        assertEquals(first, result.getPrimaryBox());
    }
}
