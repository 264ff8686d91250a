package com.convolab.server.kernel;

import com.convolab.server.engine.Matrix;

import java.util.Arrays;

/**
 * Produces square kernels of any odd size for the presets in {@link KernelPreset}.
 *
 * At a preset's natural size the canonical matrix is returned as-is. Other
 * sizes follow the preset's own scaling rule: exact formulas where one exists
 * (identity, box blur), hand-tuned tables where they exist (Gaussian 5/7/9),
 * and structural approximations otherwise.
 */
public class KernelSynthesizer {

    private static final double[][] GAUSSIAN_5 = {
            { 1, 4, 7, 4, 1 },
            { 4, 16, 26, 16, 4 },
            { 7, 26, 41, 26, 7 },
            { 4, 16, 26, 16, 4 },
            { 1, 4, 7, 4, 1 } };

    private static final double[][] GAUSSIAN_7 = {
            { 0, 0, 1, 2, 1, 0, 0 },
            { 0, 3, 13, 22, 13, 3, 0 },
            { 1, 13, 59, 97, 59, 13, 1 },
            { 2, 22, 97, 159, 97, 22, 2 },
            { 1, 13, 59, 97, 59, 13, 1 },
            { 0, 3, 13, 22, 13, 3, 0 },
            { 0, 0, 1, 2, 1, 0, 0 } };

    private static final double[][] GAUSSIAN_9 = {
            { 0, 0, 0, 1, 1, 1, 0, 0, 0 },
            { 0, 1, 3, 6, 7, 6, 3, 1, 0 },
            { 0, 3, 12, 26, 33, 26, 12, 3, 0 },
            { 1, 6, 26, 55, 71, 55, 26, 6, 1 },
            { 1, 7, 33, 71, 91, 71, 33, 7, 1 },
            { 1, 6, 26, 55, 71, 55, 26, 6, 1 },
            { 0, 3, 12, 26, 33, 26, 12, 3, 0 },
            { 0, 1, 3, 6, 7, 6, 3, 1, 0 },
            { 0, 0, 0, 1, 1, 1, 0, 0, 0 } };

    public static Matrix synthesize(KernelPreset preset, int size) {
        if (preset == null) {
            throw new IllegalArgumentException("Kernel preset must not be null");
        }
        if (size < 1 || size % 2 == 0) {
            throw new IllegalArgumentException("Kernel size must be a positive odd number, got " + size);
        }
        if (size == preset.getNaturalSize()) {
            return Matrix.of(preset.canonicalCopy());
        }
        return Matrix.of(preset.scaled(size));
    }

    public static Matrix synthesize(String presetKey, int size) {
        return synthesize(KernelPreset.fromKey(presetKey), size);
    }

    static double[][] constant(int size, double value) {
        double[][] k = new double[size][size];
        for (double[] row : k) {
            Arrays.fill(row, value);
        }
        return k;
    }

    static int chebyshev(int r, int c, int center) {
        return Math.max(Math.abs(r - center), Math.abs(c - center));
    }

    static double[][] gaussian(int size) {
        switch (size) {
            case 1:
                return new double[][] { { 1.0 } };
            case 5:
                return normalized(GAUSSIAN_5);
            case 7:
                return normalized(GAUSSIAN_7);
            case 9:
                return normalized(GAUSSIAN_9);
            default:
                break;
        }
        int center = size / 2;
        double sigma = size / 6.0;
        double[][] k = new double[size][size];
        for (int r = 0; r < size; r++) {
            for (int c = 0; c < size; c++) {
                double d2 = (r - center) * (r - center) + (c - center) * (c - center);
                k[r][c] = Math.exp(-d2 / (2 * sigma * sigma));
            }
        }
        return normalized(k);
    }

    /**
     * Sharpen kernel summing to exactly 1. Sizes above 3 use inverse-distance
     * negatives within Chebyshev radius 2 and absorb the remainder in the center.
     */
    static double[][] sharpen(int size) {
        int center = size / 2;
        double[][] k = new double[size][size];
        if (size <= 3) {
            for (double[] row : k) {
                Arrays.fill(row, -1.0);
            }
            k[center][center] = size * size;
            return k;
        }

        k[center][center] = 2.0 * size;
        for (int r = 0; r < size; r++) {
            for (int c = 0; c < size; c++) {
                int d = chebyshev(r, c, center);
                if (d > 0 && d <= 2) {
                    k[r][c] = -1.0 / d;
                }
            }
        }
        k[center][center] += 1.0 - sum(k);
        return k;
    }

    /**
     * Laplacian-style edge kernel summing to 0: the center holds size^2 - 1
     * and the negatives are scaled to cancel it.
     */
    static double[][] laplacian(int size) {
        int center = size / 2;
        double total = size * size - 1;
        double[][] k = new double[size][size];
        if (size <= 3) {
            for (double[] row : k) {
                Arrays.fill(row, -1.0);
            }
            k[center][center] = total;
            return k;
        }

        double negativeSum = 0.0;
        for (int r = 0; r < size; r++) {
            for (int c = 0; c < size; c++) {
                int d = chebyshev(r, c, center);
                if (d > 0) {
                    k[r][c] = -1.0 / d;
                    negativeSum += k[r][c];
                }
            }
        }
        double scale = -total / negativeSum;
        for (int r = 0; r < size; r++) {
            for (int c = 0; c < size; c++) {
                if (k[r][c] < 0) {
                    k[r][c] *= scale;
                }
            }
        }
        k[center][center] = total;
        return k;
    }

    /**
     * Directional step: -1 before the center line, +1 after it, 0 on it.
     * Horizontal steps vary along columns (Sobel X), vertical along rows.
     */
    static double[][] step(int size, boolean horizontal) {
        int center = size / 2;
        double[][] k = new double[size][size];
        for (int r = 0; r < size; r++) {
            for (int c = 0; c < size; c++) {
                int pos = horizontal ? c : r;
                k[r][c] = Integer.signum(pos - center);
            }
        }
        return k;
    }

    // +1 below the main diagonal, -1 above, 0 on it
    static double[][] diagonal(int size) {
        double[][] k = new double[size][size];
        for (int r = 0; r < size; r++) {
            for (int c = 0; c < size; c++) {
                k[r][c] = Integer.signum(r - c);
            }
        }
        return k;
    }

    private static double[][] normalized(double[][] weights) {
        double total = sum(weights);
        double[][] k = new double[weights.length][];
        for (int r = 0; r < weights.length; r++) {
            k[r] = new double[weights[r].length];
            for (int c = 0; c < weights[r].length; c++) {
                k[r][c] = weights[r][c] / total;
            }
        }
        return k;
    }

    private static double sum(double[][] k) {
        double total = 0.0;
        for (double[] row : k) {
            for (double v : row) {
                total += v;
            }
        }
        return total;
    }
}
