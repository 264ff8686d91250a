package com.convolab.server.engine;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Rectangular 2D grid of doubles. Instances are immutable: values are copied
 * on the way in and on the way out, so a Matrix never aliases caller state.
 */
public final class Matrix {

    // values[row][col]
    private final double[][] values;
    private final int rows;
    private final int cols;

    private Matrix(double[][] values, boolean copy) {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("Matrix must have at least one row");
        }
        int width = values[0] == null ? 0 : values[0].length;
        if (width == 0) {
            throw new IllegalArgumentException("Matrix must have at least one column");
        }
        double[][] data = copy ? new double[values.length][] : values;
        for (int r = 0; r < values.length; r++) {
            if (values[r] == null || values[r].length != width) {
                throw new IllegalArgumentException("Matrix rows must all have length " + width + " (row " + r + ")");
            }
            if (copy) {
                data[r] = values[r].clone();
            }
        }
        this.values = data;
        this.rows = values.length;
        this.cols = width;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Matrix of(double[][] values) {
        return new Matrix(values, true);
    }

    public static Matrix zeros(int rows, int cols) {
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("Matrix dimensions must be positive: " + rows + "x" + cols);
        }
        return new Matrix(new double[rows][cols], false);
    }

    public static Matrix filled(int rows, int cols, double value) {
        double[][] data = new double[rows][cols];
        for (double[] row : data) {
            Arrays.fill(row, value);
        }
        return new Matrix(data, false);
    }

    // Takes ownership of the array; callers must not keep a reference.
    static Matrix wrap(double[][] values) {
        return new Matrix(values, false);
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    public double get(int row, int col) {
        return values[row][col];
    }

    public double sum() {
        double total = 0.0;
        for (double[] row : values) {
            for (double v : row) {
                total += v;
            }
        }
        return total;
    }

    @JsonValue
    public double[][] toArray() {
        double[][] out = new double[rows][];
        for (int r = 0; r < rows; r++) {
            out[r] = values[r].clone();
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Matrix)) {
            return false;
        }
        return Arrays.deepEquals(values, ((Matrix) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(values);
    }

    @Override
    public String toString() {
        return "Matrix" + rows + "x" + cols + Arrays.deepToString(values);
    }
}
