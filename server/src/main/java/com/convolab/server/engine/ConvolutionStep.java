package com.convolab.server.engine;

import java.util.Objects;

/**
 * One window position of a convolution, kept so the caller can replay the
 * computation cell by cell.
 */
public final class ConvolutionStep {
    // Window top-left in unpadded input coordinates; negative inside the top/left padding.
    private final int row;
    private final int col;
    private final Matrix inputPatch;
    private final Matrix kernelValues;
    private final Matrix elementWiseProducts;
    private final double sum;
    private final int outputRow;
    private final int outputCol;

    public ConvolutionStep(int row, int col, Matrix inputPatch, Matrix kernelValues, Matrix elementWiseProducts,
            double sum, int outputRow, int outputCol) {
        this.row = row;
        this.col = col;
        this.inputPatch = inputPatch;
        this.kernelValues = kernelValues;
        this.elementWiseProducts = elementWiseProducts;
        this.sum = sum;
        this.outputRow = outputRow;
        this.outputCol = outputCol;
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }

    public Matrix getInputPatch() {
        return inputPatch;
    }

    public Matrix getKernelValues() {
        return kernelValues;
    }

    public Matrix getElementWiseProducts() {
        return elementWiseProducts;
    }

    public double getSum() {
        return sum;
    }

    public int getOutputRow() {
        return outputRow;
    }

    public int getOutputCol() {
        return outputCol;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ConvolutionStep)) {
            return false;
        }
        ConvolutionStep that = (ConvolutionStep) o;
        return row == that.row && col == that.col && outputRow == that.outputRow && outputCol == that.outputCol
                && Double.compare(sum, that.sum) == 0 && inputPatch.equals(that.inputPatch)
                && kernelValues.equals(that.kernelValues) && elementWiseProducts.equals(that.elementWiseProducts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, col, inputPatch, kernelValues, elementWiseProducts, sum, outputRow, outputCol);
    }

    @Override
    public String toString() {
        return "ConvolutionStep{out=(" + outputRow + "," + outputCol + "), pos=(" + row + "," + col + "), sum=" + sum
                + "}";
    }
}
