package com.convolab.server.engine;

/**
 * Input area covered by the kernel at one step.
 *
 * Always the full kernel size, even when part of it lies in the padding or
 * past the image edge; the caller clips when drawing if it wants to.
 */
public final class HighlightRegion {
    private final int startRow;
    private final int startCol;
    private final int paddedStartRow;
    private final int paddedStartCol;
    private final int height;
    private final int width;

    public HighlightRegion(int startRow, int startCol, int paddedStartRow, int paddedStartCol, int height,
            int width) {
        this.startRow = startRow;
        this.startCol = startCol;
        this.paddedStartRow = paddedStartRow;
        this.paddedStartCol = paddedStartCol;
        this.height = height;
        this.width = width;
    }

    public static HighlightRegion forStep(ConvolutionStep step, PaddingAmounts padding) {
        Matrix kernel = step.getKernelValues();
        return new HighlightRegion(step.getRow(), step.getCol(), step.getRow() + padding.getTop(),
                step.getCol() + padding.getLeft(), kernel.rows(), kernel.cols());
    }

    public int getStartRow() {
        return startRow;
    }

    public int getStartCol() {
        return startCol;
    }

    public int getPaddedStartRow() {
        return paddedStartRow;
    }

    public int getPaddedStartCol() {
        return paddedStartCol;
    }

    public int getHeight() {
        return height;
    }

    public int getWidth() {
        return width;
    }
}
