package com.convolab.server.config;

/**
 * Defaults the service falls back to when a request leaves a parameter out,
 * plus the limits it enforces. Bound from convolution_config.json.
 */
public class ConvolutionConfig {
    public int defaultStride = 1;
    public String defaultPadding = "valid";
    public String defaultPreset = "identity";
    public int defaultKernelSize = 3;
    public int defaultSampleSize = 64;

    // Largest accepted input side; the UI resizes uploads to 64
    public int maxInputSize = 64;
    public int maxKernelSize = 15;

    public boolean parallel = false;

    public ConvolutionConfig() {
    }

    public static ConvolutionConfig defaults() {
        return new ConvolutionConfig();
    }

    public ConvolutionConfig copy() {
        ConvolutionConfig c = new ConvolutionConfig();
        c.defaultStride = this.defaultStride;
        c.defaultPadding = this.defaultPadding;
        c.defaultPreset = this.defaultPreset;
        c.defaultKernelSize = this.defaultKernelSize;
        c.defaultSampleSize = this.defaultSampleSize;
        c.maxInputSize = this.maxInputSize;
        c.maxKernelSize = this.maxKernelSize;
        c.parallel = this.parallel;
        return c;
    }
}
