package com.convolab.server.display;

import com.convolab.server.engine.Matrix;

/**
 * Maps raw convolution output into the 0..255 range a grayscale view can show.
 */
public class OutputPostProcessor {

    public static final double MAX_INTENSITY = 255.0;

    /**
     * Linearly stretches the matrix so its minimum becomes 0 and its maximum
     * 255, rounding each cell. A constant matrix has no range to stretch and is
     * returned unchanged.
     */
    public static Matrix normalize(Matrix output) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int r = 0; r < output.rows(); r++) {
            for (int c = 0; c < output.cols(); c++) {
                double v = output.get(r, c);
                if (v < min)
                    min = v;
                if (v > max)
                    max = v;
            }
        }

        double range = max - min;
        if (range == 0.0) {
            return output;
        }

        double[][] out = new double[output.rows()][output.cols()];
        for (int r = 0; r < output.rows(); r++) {
            for (int c = 0; c < output.cols(); c++) {
                out[r][c] = Math.round((output.get(r, c) - min) / range * MAX_INTENSITY);
            }
        }
        return Matrix.of(out);
    }

    // Round, then cut anything outside 0..255
    public static Matrix clamp(Matrix output) {
        double[][] out = new double[output.rows()][output.cols()];
        for (int r = 0; r < output.rows(); r++) {
            for (int c = 0; c < output.cols(); c++) {
                double v = Math.round(output.get(r, c));
                out[r][c] = Math.max(0.0, Math.min(MAX_INTENSITY, v));
            }
        }
        return Matrix.of(out);
    }
}
