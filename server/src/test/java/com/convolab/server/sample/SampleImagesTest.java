package com.convolab.server.sample;

import com.convolab.server.engine.Matrix;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SampleImagesTest {

    @Test
    public void testCheckerboardBlocks() {
        Matrix m = SampleImages.CHECKERBOARD.generate(SampleImages.DEFAULT_SIZE);
        assertEquals(64, m.rows());
        assertEquals(255.0, m.get(0, 0));
        assertEquals(255.0, m.get(7, 7));
        assertEquals(0.0, m.get(0, 8));
        assertEquals(0.0, m.get(8, 0));
        assertEquals(255.0, m.get(8, 8));
    }

    @Test
    public void testGradientRunsDarkToLight() {
        Matrix m = SampleImages.GRADIENT.generate(64);
        assertEquals(0.0, m.get(10, 0));
        assertEquals(255.0, m.get(10, 63));
        assertEquals(m.get(0, 30), m.get(63, 30));
        assertEquals(0.0, SampleImages.GRADIENT.generate(1).get(0, 0));
    }

    @Test
    public void testCircleIsCentered() {
        Matrix m = SampleImages.CIRCLE.generate(64);
        assertEquals(255.0, m.get(32, 32));
        assertEquals(0.0, m.get(0, 0));
        assertEquals(0.0, m.get(32, 60));
    }

    @Test
    public void testNoiseIsSeeded() {
        assertEquals(SampleImages.NOISE.generate(16, 3L), SampleImages.NOISE.generate(16, 3L));
        assertNotEquals(SampleImages.NOISE.generate(16, 3L), SampleImages.NOISE.generate(16, 4L));
        Matrix m = SampleImages.NOISE.generate(16, 3L);
        for (double[] row : m.toArray()) {
            for (double v : row) {
                assertTrue(v >= 0 && v <= 255);
            }
        }
    }

    @Test
    public void testLookupByKey() {
        assertEquals(SampleImages.CIRCLE, SampleImages.fromKey("Circle"));
        assertThrows(IllegalArgumentException.class, () -> SampleImages.fromKey("mandrill"));
        assertThrows(IllegalArgumentException.class, () -> SampleImages.fromKey(null));
    }
}
