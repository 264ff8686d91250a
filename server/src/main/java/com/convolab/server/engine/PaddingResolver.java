package com.convolab.server.engine;

/**
 * Works out how many rows and columns each padding mode adds on every side.
 */
public class PaddingResolver {

    public static PaddingAmounts resolve(int inputH, int inputW, int kernelH, int kernelW, int strideH, int strideW,
            PaddingMode mode) {
        switch (mode) {
            case VALID:
                return PaddingAmounts.NONE;
            case SAME: {
                // ceil(input / stride), written with integer math
                int outH = (inputH + strideH - 1) / strideH;
                int outW = (inputW + strideW - 1) / strideW;

                int totalH = Math.max((outH - 1) * strideH + kernelH - inputH, 0);
                int totalW = Math.max((outW - 1) * strideW + kernelW - inputW, 0);

                // Odd totals put the extra pixel on bottom/right
                int top = totalH / 2;
                int left = totalW / 2;
                return new PaddingAmounts(top, totalH - top, left, totalW - left);
            }
            case ZERO:
            case REFLECT:
            case REPLICATE:
                return PaddingAmounts.symmetric(kernelH / 2, kernelW / 2);
            default:
                throw new IllegalArgumentException("Unsupported padding mode: " + mode);
        }
    }
}
