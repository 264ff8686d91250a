package com.convolab.server.sample;

import com.convolab.server.engine.Matrix;

import java.util.Locale;
import java.util.Random;

/**
 * Synthetic grayscale inputs for trying kernels without uploading an image.
 */
public enum SampleImages {

    CHECKERBOARD("checkerboard", "Checkerboard") {
        @Override
        public Matrix generate(int size, long seed) {
            double[][] px = new double[size][size];
            for (int r = 0; r < size; r++) {
                for (int c = 0; c < size; c++) {
                    int block = r / CHECKER_BLOCK + c / CHECKER_BLOCK;
                    px[r][c] = block % 2 == 0 ? 255 : 0;
                }
            }
            return Matrix.of(px);
        }
    },

    GRADIENT("gradient", "Horizontal Gradient") {
        @Override
        public Matrix generate(int size, long seed) {
            double[][] px = new double[size][size];
            for (int r = 0; r < size; r++) {
                for (int c = 0; c < size; c++) {
                    // Dark on the left, light on the right
                    px[r][c] = size == 1 ? 0 : Math.round((double) c / (size - 1) * 255);
                }
            }
            return Matrix.of(px);
        }
    },

    CIRCLE("circle", "White Circle") {
        @Override
        public Matrix generate(int size, long seed) {
            double[][] px = new double[size][size];
            double center = size / 2.0;
            double radius = size * 0.3;
            for (int r = 0; r < size; r++) {
                for (int c = 0; c < size; c++) {
                    double distance = Math.sqrt((r - center) * (r - center) + (c - center) * (c - center));
                    px[r][c] = distance <= radius ? 255 : 0;
                }
            }
            return Matrix.of(px);
        }
    },

    NOISE("noise", "Random Noise") {
        @Override
        public Matrix generate(int size, long seed) {
            Random random = new Random(seed);
            double[][] px = new double[size][size];
            for (int r = 0; r < size; r++) {
                for (int c = 0; c < size; c++) {
                    px[r][c] = random.nextInt(256);
                }
            }
            return Matrix.of(px);
        }
    };

    public static final int DEFAULT_SIZE = 64;
    private static final int CHECKER_BLOCK = 8;

    private final String key;
    private final String displayName;

    SampleImages(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    /**
     * Builds a size x size image. Only {@link #NOISE} looks at the seed.
     */
    public abstract Matrix generate(int size, long seed);

    public Matrix generate(int size) {
        return generate(size, 0L);
    }

    public String getKey() {
        return key;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static SampleImages fromKey(String key) {
        if (key != null) {
            String normalized = key.trim().toLowerCase(Locale.ROOT);
            for (SampleImages s : values()) {
                if (s.key.equals(normalized)) {
                    return s;
                }
            }
        }
        throw new IllegalArgumentException("Unknown sample image '" + key + "'");
    }
}
