package com.convolab.server.engine;

/**
 * Builds the padded copy of an input according to a mode's border-fill rule.
 *
 * The original input always occupies rows [top, top + h) and columns
 * [left, left + w) of the result.
 */
public class PaddingApplier {

    public static Matrix apply(Matrix input, PaddingAmounts amounts, PaddingMode mode) {
        int h = input.rows();
        int w = input.cols();

        if (amounts.isZero()) {
            return Matrix.wrap(input.toArray());
        }

        int top = amounts.getTop();
        int left = amounts.getLeft();
        int paddedH = paddedSize(h, top, amounts.getBottom());
        int paddedW = paddedSize(w, left, amounts.getRight());

        double[][] padded;
        switch (mode) {
            case REPLICATE:
                padded = replicate(input, top, left, paddedH, paddedW);
                break;
            case REFLECT:
                padded = copyCenter(input, top, left, paddedH, paddedW);
                reflectRows(padded, top, h);
                reflectColumns(padded, left, w);
                break;
            case VALID:
            case ZERO:
            case SAME:
            default:
                // Border stays at the array's 0.0 initial value
                padded = copyCenter(input, top, left, paddedH, paddedW);
                break;
        }
        return Matrix.wrap(padded);
    }

    private static int paddedSize(int size, int before, int after) {
        try {
            return Math.addExact(Math.addExact(size, before), after);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(
                    "Padded size overflows: " + size + " + " + before + " + " + after, e);
        }
    }

    private static double[][] copyCenter(Matrix input, int top, int left, int paddedH, int paddedW) {
        double[][] padded = new double[paddedH][paddedW];
        for (int r = 0; r < input.rows(); r++) {
            for (int c = 0; c < input.cols(); c++) {
                padded[r + top][c + left] = input.get(r, c);
            }
        }
        return padded;
    }

    // Top and bottom bands, interior columns only. Corners are filled by the column pass.
    private static void reflectRows(double[][] padded, int top, int h) {
        int paddedW = padded[0].length;
        for (int r = 0; r < padded.length; r++) {
            int local = r - top;
            if (local >= 0 && local < h) {
                continue;
            }
            int src = reflectIndex(local, h) + top;
            System.arraycopy(padded[src], 0, padded[r], 0, paddedW);
        }
    }

    private static void reflectColumns(double[][] padded, int left, int w) {
        int paddedW = padded[0].length;
        for (double[] row : padded) {
            for (int c = 0; c < paddedW; c++) {
                int local = c - left;
                if (local >= 0 && local < w) {
                    continue;
                }
                row[c] = row[reflectIndex(local, w) + left];
            }
        }
    }

    /**
     * Maps an index outside [0, size) onto the mirror image that excludes the
     * edge itself, so for [a, b, c] index -1 maps to b and index 3 maps to b.
     * Keeps bouncing when the pad is wider than the input.
     */
    static int reflectIndex(int index, int size) {
        if (size == 1) {
            return 0;
        }
        int period = 2 * (size - 1);
        int m = Math.floorMod(index, period);
        return m < size ? m : period - m;
    }

    private static double[][] replicate(Matrix input, int top, int left, int paddedH, int paddedW) {
        int h = input.rows();
        int w = input.cols();
        double[][] padded = new double[paddedH][paddedW];
        for (int r = 0; r < paddedH; r++) {
            int srcRow = clamp(r - top, h);
            for (int c = 0; c < paddedW; c++) {
                padded[r][c] = input.get(srcRow, clamp(c - left, w));
            }
        }
        return padded;
    }

    private static int clamp(int index, int size) {
        if (index < 0) {
            return 0;
        }
        return index >= size ? size - 1 : index;
    }
}
