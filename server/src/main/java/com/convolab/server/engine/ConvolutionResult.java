package com.convolab.server.engine;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public final class ConvolutionResult {
    private final Matrix output;
    private final List<ConvolutionStep> steps;
    private final OutputDimensions outputDimensions;
    private final PaddingAmounts paddingValues;

    public ConvolutionResult(Matrix output, List<ConvolutionStep> steps, OutputDimensions outputDimensions,
            PaddingAmounts paddingValues) {
        this.output = output;
        this.steps = Collections.unmodifiableList(steps);
        this.outputDimensions = outputDimensions;
        this.paddingValues = paddingValues;
    }

    public Matrix getOutput() {
        return output;
    }

    // Row-major by output coordinate
    public List<ConvolutionStep> getSteps() {
        return steps;
    }

    public OutputDimensions getOutputDimensions() {
        return outputDimensions;
    }

    public PaddingAmounts getPaddingValues() {
        return paddingValues;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ConvolutionResult)) {
            return false;
        }
        ConvolutionResult that = (ConvolutionResult) o;
        return output.equals(that.output) && steps.equals(that.steps)
                && outputDimensions.equals(that.outputDimensions) && paddingValues.equals(that.paddingValues);
    }

    @Override
    public int hashCode() {
        return Objects.hash(output, steps, outputDimensions, paddingValues);
    }
}
