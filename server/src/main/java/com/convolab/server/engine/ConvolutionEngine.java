package com.convolab.server.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Slides a kernel over a padded input and records every window it visits.
 *
 * Stateless: each call builds a fresh {@link ConvolutionResult}, so one
 * instance can be shared between threads.
 */
public class ConvolutionEngine {

    private static final Logger logger = LoggerFactory.getLogger(ConvolutionEngine.class);

    /**
     * Output size for the given padded geometry:
     * floor((input + padBefore + padAfter - kernel) / stride) + 1, never below 1.
     */
    public static OutputDimensions calculateOutputDimensions(int inputH, int inputW, int kernelH, int kernelW,
            int strideH, int strideW, PaddingAmounts padding) {
        int height = Math.floorDiv(inputH + padding.getTop() + padding.getBottom() - kernelH, strideH) + 1;
        int width = Math.floorDiv(inputW + padding.getLeft() + padding.getRight() - kernelW, strideW) + 1;
        return new OutputDimensions(Math.max(1, height), Math.max(1, width));
    }

    public static OutputDimensions calculateOutputDimensions(int inputH, int inputW, int kernelSize, int stride,
            PaddingMode mode) {
        PaddingAmounts padding = PaddingResolver.resolve(inputH, inputW, kernelSize, kernelSize, stride, stride, mode);
        return calculateOutputDimensions(inputH, inputW, kernelSize, kernelSize, stride, stride, padding);
    }

    public ConvolutionResult convolve(Matrix input, Matrix kernel, int stride, PaddingMode mode) {
        return run(input, kernel, stride, mode, false);
    }

    /**
     * Same result as {@link #convolve}, with output rows computed concurrently.
     * Steps are still returned in row-major order.
     */
    public ConvolutionResult convolveParallel(Matrix input, Matrix kernel, int stride, PaddingMode mode) {
        return run(input, kernel, stride, mode, true);
    }

    private ConvolutionResult run(Matrix input, Matrix kernel, int stride, PaddingMode mode, boolean parallel) {
        checkArguments(input, kernel, stride, mode);

        int kh = kernel.rows();
        int kw = kernel.cols();

        PaddingAmounts padding = PaddingResolver.resolve(input.rows(), input.cols(), kh, kw, stride, stride, mode);
        Matrix padded = PaddingApplier.apply(input, padding, mode);
        OutputDimensions dims = calculateOutputDimensions(input.rows(), input.cols(), kh, kw, stride, stride,
                padding);

        logger.debug("Convolving {}x{} input with {}x{} kernel, stride={}, mode={}, padding={}, output={}",
                input.rows(), input.cols(), kh, kw, stride, mode, padding, dims);

        double[][] output = new double[dims.getHeight()][dims.getWidth()];

        List<List<ConvolutionStep>> rowSteps = new ArrayList<>(dims.getHeight());
        for (int i = 0; i < dims.getHeight(); i++) {
            rowSteps.add(null);
        }

        IntStream rows = IntStream.range(0, dims.getHeight());
        if (parallel) {
            rows = rows.parallel();
        }
        // Each task owns output[i] and slot i of rowSteps, so no locking is needed
        rows.forEach(i -> rowSteps.set(i, computeRow(i, padded, kernel, stride, padding, output[i])));

        List<ConvolutionStep> steps = new ArrayList<>(dims.getHeight() * dims.getWidth());
        for (List<ConvolutionStep> row : rowSteps) {
            steps.addAll(row);
        }

        int expected = dims.getHeight() * dims.getWidth();
        if (steps.size() != expected) {
            logger.debug("Skipped {} out-of-range windows (output clamped to {})", expected - steps.size(), dims);
        }

        return new ConvolutionResult(Matrix.wrap(output), steps, dims, padding);
    }

    private static List<ConvolutionStep> computeRow(int outRow, Matrix padded, Matrix kernel, int stride,
            PaddingAmounts padding, double[] outputRow) {
        int kh = kernel.rows();
        int kw = kernel.cols();
        int r0 = outRow * stride;

        List<ConvolutionStep> steps = new ArrayList<>(outputRow.length);
        if (r0 + kh > padded.rows()) {
            return steps;
        }

        for (int outCol = 0; outCol < outputRow.length; outCol++) {
            int c0 = outCol * stride;
            if (c0 + kw > padded.cols()) {
                // Only reachable when the width was clamped up to 1; the cell stays 0
                continue;
            }

            double[][] patch = new double[kh][kw];
            double[][] products = new double[kh][kw];
            double sum = 0.0;
            for (int ki = 0; ki < kh; ki++) {
                for (int kj = 0; kj < kw; kj++) {
                    double in = padded.get(r0 + ki, c0 + kj);
                    double p = in * kernel.get(ki, kj);
                    patch[ki][kj] = in;
                    products[ki][kj] = p;
                    sum += p;
                }
            }

            outputRow[outCol] = sum;
            steps.add(new ConvolutionStep(r0 - padding.getTop(), c0 - padding.getLeft(), Matrix.wrap(patch), kernel,
                    Matrix.wrap(products), sum, outRow, outCol));
        }
        return steps;
    }

    private static void checkArguments(Matrix input, Matrix kernel, int stride, PaddingMode mode) {
        if (input == null) {
            throw new IllegalArgumentException("Input matrix must not be null");
        }
        if (kernel == null) {
            throw new IllegalArgumentException("Kernel must not be null");
        }
        if (mode == null) {
            throw new IllegalArgumentException("Padding mode must not be null");
        }
        if (stride < 1) {
            throw new IllegalArgumentException("Stride must be at least 1, got " + stride);
        }
    }
}
