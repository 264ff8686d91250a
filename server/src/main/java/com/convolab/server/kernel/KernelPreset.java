package com.convolab.server.kernel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The kernels the lab knows how to build. Each constant carries its canonical
 * matrix and its own rule for producing other odd sizes.
 */
public enum KernelPreset {

    IDENTITY("identity", "Identity", new double[][] { { 1 } }) {
        @Override
        double[][] scaled(int size) {
            double[][] k = new double[size][size];
            int center = size / 2;
            k[center][center] = 1.0;
            return k;
        }
    },

    BOX_BLUR("box_blur", "Box Blur", new double[][] {
            { 1.0 / 9, 1.0 / 9, 1.0 / 9 },
            { 1.0 / 9, 1.0 / 9, 1.0 / 9 },
            { 1.0 / 9, 1.0 / 9, 1.0 / 9 } }) {
        @Override
        double[][] scaled(int size) {
            return KernelSynthesizer.constant(size, 1.0 / (size * size));
        }
    },

    GAUSSIAN("gaussian", "Gaussian", new double[][] {
            { 1.0 / 16, 2.0 / 16, 1.0 / 16 },
            { 2.0 / 16, 4.0 / 16, 2.0 / 16 },
            { 1.0 / 16, 2.0 / 16, 1.0 / 16 } }) {
        @Override
        double[][] scaled(int size) {
            return KernelSynthesizer.gaussian(size);
        }
    },

    SHARPEN("sharpen", "Sharpen", new double[][] {
            { 0, -1, 0 },
            { -1, 5, -1 },
            { 0, -1, 0 } }) {
        @Override
        double[][] scaled(int size) {
            return KernelSynthesizer.sharpen(size);
        }
    },

    EDGE_DETECT("edge_detect", "Edge Detect", new double[][] {
            { 0, -1, 0 },
            { -1, 4, -1 },
            { 0, -1, 0 } }) {
        @Override
        double[][] scaled(int size) {
            return KernelSynthesizer.laplacian(size);
        }
    },

    SOBEL_X("sobel_x", "Sobel X", new double[][] {
            { -1, 0, 1 },
            { -2, 0, 2 },
            { -1, 0, 1 } }) {
        @Override
        double[][] scaled(int size) {
            return KernelSynthesizer.step(size, true);
        }
    },

    SOBEL_Y("sobel_y", "Sobel Y", new double[][] {
            { -1, -2, -1 },
            { 0, 0, 0 },
            { 1, 2, 1 } }) {
        @Override
        double[][] scaled(int size) {
            return KernelSynthesizer.step(size, false);
        }
    },

    EMBOSS("emboss", "Emboss", new double[][] {
            { -2, -1, 0 },
            { -1, 1, 1 },
            { 0, 1, 2 } }) {
        @Override
        double[][] scaled(int size) {
            return KernelSynthesizer.diagonal(size);
        }
    };

    private final String key;
    private final String displayName;
    private final double[][] canonical;

    KernelPreset(String key, String displayName, double[][] canonical) {
        this.key = key;
        this.displayName = displayName;
        this.canonical = canonical;
    }

    /**
     * Builds this preset at a size other than its natural one.
     */
    abstract double[][] scaled(int size);

    @JsonValue
    public String getKey() {
        return key;
    }

    public String getDisplayName() {
        return displayName;
    }

    public int getNaturalSize() {
        return canonical.length;
    }

    double[][] canonicalCopy() {
        double[][] copy = new double[canonical.length][];
        for (int r = 0; r < canonical.length; r++) {
            copy[r] = canonical[r].clone();
        }
        return copy;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static KernelPreset fromKey(String key) {
        if (key == null || key.trim().isEmpty()) {
            throw new IllegalArgumentException("Kernel preset must not be empty");
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        // The UI historically prefixed the Sobel presets with "edge_"
        if (normalized.startsWith("edge_sobel_")) {
            normalized = normalized.substring("edge_".length());
        }
        for (KernelPreset preset : values()) {
            if (preset.key.equals(normalized)) {
                return preset;
            }
        }
        throw new IllegalArgumentException("Unknown kernel preset '" + key + "'");
    }
}
