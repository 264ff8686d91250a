package com.convolab.server.engine;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public final class OutputDimensions {
    private final int height;
    private final int width;

    @JsonCreator
    public OutputDimensions(@JsonProperty("height") int height, @JsonProperty("width") int width) {
        this.height = height;
        this.width = width;
    }

    public int getHeight() {
        return height;
    }

    public int getWidth() {
        return width;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof OutputDimensions)) {
            return false;
        }
        OutputDimensions that = (OutputDimensions) o;
        return height == that.height && width == that.width;
    }

    @Override
    public int hashCode() {
        return height * 31 + width;
    }

    @Override
    public String toString() {
        return height + "x" + width;
    }
}
