package com.convolab.server.engine;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Number of rows/columns added on each side of an input before convolving.
 */
public final class PaddingAmounts {

    public static final PaddingAmounts NONE = new PaddingAmounts(0, 0, 0, 0);

    private final int top;
    private final int bottom;
    private final int left;
    private final int right;

    @JsonCreator
    public PaddingAmounts(@JsonProperty("top") int top, @JsonProperty("bottom") int bottom,
            @JsonProperty("left") int left, @JsonProperty("right") int right) {
        if (top < 0 || bottom < 0 || left < 0 || right < 0) {
            throw new IllegalArgumentException(
                    "Padding amounts must be non-negative: top=" + top + ", bottom=" + bottom + ", left=" + left
                            + ", right=" + right);
        }
        this.top = top;
        this.bottom = bottom;
        this.left = left;
        this.right = right;
    }

    public static PaddingAmounts symmetric(int vertical, int horizontal) {
        return new PaddingAmounts(vertical, vertical, horizontal, horizontal);
    }

    public int getTop() {
        return top;
    }

    public int getBottom() {
        return bottom;
    }

    public int getLeft() {
        return left;
    }

    public int getRight() {
        return right;
    }

    @JsonIgnore
    public boolean isZero() {
        return top == 0 && bottom == 0 && left == 0 && right == 0;
    }

    @JsonIgnore
    public boolean isSymmetric() {
        return top == bottom && left == right;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PaddingAmounts)) {
            return false;
        }
        PaddingAmounts that = (PaddingAmounts) o;
        return top == that.top && bottom == that.bottom && left == that.left && right == that.right;
    }

    @Override
    public int hashCode() {
        return ((top * 31 + bottom) * 31 + left) * 31 + right;
    }

    @Override
    public String toString() {
        return "PaddingAmounts{top=" + top + ", bottom=" + bottom + ", left=" + left + ", right=" + right + "}";
    }
}
