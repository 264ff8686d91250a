package com.convolab.server.service;

import com.convolab.server.config.ConfigResolver;
import com.convolab.server.config.ConvolutionConfig;
import com.convolab.server.display.OutputPostProcessor;
import com.convolab.server.engine.ConvolutionEngine;
import com.convolab.server.engine.ConvolutionResult;
import com.convolab.server.engine.ConvolutionStep;
import com.convolab.server.engine.HighlightRegion;
import com.convolab.server.engine.Matrix;
import com.convolab.server.engine.PaddingAmounts;
import com.convolab.server.engine.PaddingApplier;
import com.convolab.server.engine.PaddingMode;
import com.convolab.server.engine.PaddingResolver;
import com.convolab.server.kernel.KernelPreset;
import com.convolab.server.kernel.KernelSynthesizer;
import com.convolab.server.sample.SampleImages;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ConvolutionService {

    private static final Logger logger = LoggerFactory.getLogger(ConvolutionService.class);

    private final ConvolutionConfig config;
    private final ConvolutionEngine engine = new ConvolutionEngine();

    public ConvolutionService() {
        this(ConfigResolver.resolve());
    }

    public ConvolutionService(ConvolutionConfig config) {
        this.config = config;
    }

    @PostConstruct
    public void init() {
        logger.info("Convolution service ready: defaultStride={}, defaultPadding={}, defaultPreset={}, "
                + "maxInputSize={}, maxKernelSize={}, parallel={}", config.defaultStride, config.defaultPadding,
                config.defaultPreset, config.maxInputSize, config.maxKernelSize, config.parallel);
    }

    public ConvolutionConfig getConfig() {
        return config.copy();
    }

    public PaddingAmounts resolvePadding(int inputH, int inputW, int kernelH, int kernelW, int strideH, int strideW,
            PaddingMode mode) {
        requirePositive("inputH", inputH);
        requirePositive("inputW", inputW);
        requirePositive("kernelH", kernelH);
        requirePositive("kernelW", kernelW);
        requirePositive("strideH", strideH);
        requirePositive("strideW", strideW);
        return PaddingResolver.resolve(inputH, inputW, kernelH, kernelW, strideH, strideW, modeOrDefault(mode));
    }

    public Matrix applyPadding(Matrix input, PaddingAmounts amounts, PaddingMode mode) {
        checkInputSize(input);
        if (amounts == null) {
            throw new IllegalArgumentException("Padding amounts must not be null");
        }
        checkPadding(amounts);
        return PaddingApplier.apply(input, amounts, modeOrDefault(mode));
    }

    public Matrix synthesizeKernel(KernelPreset preset, Integer size) {
        KernelPreset p = preset != null ? preset : KernelPreset.fromKey(config.defaultPreset);
        int s = size != null ? size : config.defaultKernelSize;
        if (s > config.maxKernelSize) {
            throw new IllegalArgumentException("Kernel size " + s + " exceeds limit " + config.maxKernelSize);
        }
        return KernelSynthesizer.synthesize(p, s);
    }

    public ConvolutionResult convolve(Matrix input, Matrix kernel, Integer stride, PaddingMode mode) {
        checkInputSize(input);
        if (kernel == null) {
            throw new IllegalArgumentException("Kernel must not be null");
        }
        if (kernel.rows() > config.maxKernelSize || kernel.cols() > config.maxKernelSize) {
            throw new IllegalArgumentException("Kernel " + kernel.rows() + "x" + kernel.cols() + " exceeds limit "
                    + config.maxKernelSize);
        }

        int s = stride != null ? stride : config.defaultStride;
        PaddingMode m = modeOrDefault(mode);

        long start = System.currentTimeMillis();
        ConvolutionResult result = config.parallel
                ? engine.convolveParallel(input, kernel, s, m)
                : engine.convolve(input, kernel, s, m);

        logger.info("Convolved {}x{} input with {}x{} kernel (stride={}, padding={}) -> {} output, {} steps in {} ms",
                input.rows(), input.cols(), kernel.rows(), kernel.cols(), s, m.getKey(),
                result.getOutputDimensions(), result.getSteps().size(), System.currentTimeMillis() - start);
        return result;
    }

    public ConvolutionResult convolvePreset(Matrix input, KernelPreset preset, Integer size, Integer stride,
            PaddingMode mode) {
        return convolve(input, synthesizeKernel(preset, size), stride, mode);
    }

    public Matrix displayMatrix(ConvolutionResult result, boolean normalize) {
        return normalize ? OutputPostProcessor.normalize(result.getOutput())
                : OutputPostProcessor.clamp(result.getOutput());
    }

    public HighlightRegion highlight(ConvolutionResult result, int stepIndex) {
        if (stepIndex < 0 || stepIndex >= result.getSteps().size()) {
            throw new IllegalArgumentException(
                    "Step index " + stepIndex + " out of range [0, " + result.getSteps().size() + ")");
        }
        ConvolutionStep step = result.getSteps().get(stepIndex);
        return HighlightRegion.forStep(step, result.getPaddingValues());
    }

    public Matrix sample(String name, Integer size, Long seed) {
        int s = size != null ? size : config.defaultSampleSize;
        if (s < 1 || s > config.maxInputSize) {
            throw new IllegalArgumentException("Sample size must be in [1, " + config.maxInputSize + "], got " + s);
        }
        return SampleImages.fromKey(name).generate(s, seed != null ? seed : 0L);
    }

    private PaddingMode modeOrDefault(PaddingMode mode) {
        return mode != null ? mode : PaddingMode.fromKey(config.defaultPadding);
    }

    private void checkInputSize(Matrix input) {
        if (input == null) {
            throw new IllegalArgumentException("Input matrix must not be null");
        }
        if (input.rows() > config.maxInputSize || input.cols() > config.maxInputSize) {
            throw new IllegalArgumentException("Input " + input.rows() + "x" + input.cols() + " exceeds limit "
                    + config.maxInputSize);
        }
    }

    // Resolved padding never exceeds kernel size - 1 per side
    private void checkPadding(PaddingAmounts amounts) {
        int limit = config.maxKernelSize;
        if (amounts.getTop() > limit || amounts.getBottom() > limit || amounts.getLeft() > limit
                || amounts.getRight() > limit) {
            throw new IllegalArgumentException("Padding " + amounts + " exceeds limit " + limit + " per side");
        }
    }

    private static void requirePositive(String name, int value) {
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
    }
}
