package com.convolab.server.display;

import com.convolab.server.engine.Matrix;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class OutputPostProcessorTest {

    @Test
    public void testNormalizeStretchesToFullRange() {
        Matrix out = OutputPostProcessor.normalize(Matrix.of(new double[][] { { 0, 5 }, { 10, -10 } }));
        // min -10, max 10: 0 -> 127.5 rounds up
        assertEquals(Matrix.of(new double[][] { { 128, 191 }, { 255, 0 } }), out);
    }

    @Test
    public void testNormalizeLeavesConstantMatrixAlone() {
        Matrix flat = Matrix.filled(3, 3, 42.5);
        assertEquals(flat, OutputPostProcessor.normalize(flat));
    }

    @Test
    public void testClampRoundsAndCuts() {
        Matrix out = OutputPostProcessor.clamp(Matrix.of(new double[][] { { -3.4, 300 }, { 12.5, 100.4 } }));
        assertEquals(Matrix.of(new double[][] { { 0, 255 }, { 13, 100 } }), out);
    }
}
