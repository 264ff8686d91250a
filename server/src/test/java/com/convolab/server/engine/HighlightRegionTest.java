package com.convolab.server.engine;

import com.convolab.server.kernel.KernelPreset;
import com.convolab.server.kernel.KernelSynthesizer;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class HighlightRegionTest {

    private final ConvolutionEngine engine = new ConvolutionEngine();

    @Test
    public void testRegionIsAlwaysFullKernelSize() {
        Matrix input = Matrix.filled(10, 10, 128);
        for (int size = 3; size <= 9; size += 2) {
            Matrix kernel = KernelSynthesizer.synthesize(KernelPreset.IDENTITY, size);
            ConvolutionResult result = engine.convolve(input, kernel, 1, PaddingMode.ZERO);
            for (ConvolutionStep step : result.getSteps()) {
                HighlightRegion region = HighlightRegion.forStep(step, result.getPaddingValues());
                assertEquals(size, region.getHeight());
                assertEquals(size, region.getWidth());
            }
        }
    }

    @Test
    public void testCornerRegionExtendsIntoPadding() {
        ConvolutionResult result = engine.convolve(Matrix.filled(4, 4, 1),
                KernelSynthesizer.synthesize(KernelPreset.BOX_BLUR, 5), 1, PaddingMode.REFLECT);

        HighlightRegion first = HighlightRegion.forStep(result.getSteps().get(0), result.getPaddingValues());
        assertEquals(-2, first.getStartRow());
        assertEquals(-2, first.getStartCol());
        assertEquals(0, first.getPaddedStartRow());
        assertEquals(0, first.getPaddedStartCol());

        HighlightRegion last = HighlightRegion.forStep(result.getSteps().get(15), result.getPaddingValues());
        assertEquals(1, last.getStartRow());
        assertEquals(5, last.getHeight());
        assertEquals(5, last.getWidth());
        // Not clipped at the image edge: rows 1..5 of a 4-row image
        assertEquals(3, last.getPaddedStartRow());
    }
}
