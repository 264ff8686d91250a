package com.convolab.server.engine;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PaddingMode {
    /** No padding; the window never leaves the input. */
    VALID("valid"),
    /** floor(k/2) per side, border filled with 0. */
    ZERO("zero"),
    /** floor(k/2) per side, border mirrored without repeating the edge pixel. */
    REFLECT("reflect"),
    /** floor(k/2) per side, border copies the nearest edge pixel. */
    REPLICATE("replicate"),
    /** Padding sized so the output is ceil(input / stride); border filled with 0. */
    SAME("same");

    private final String key;

    PaddingMode(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static PaddingMode fromKey(String key) {
        if (key == null || key.trim().isEmpty()) {
            throw new IllegalArgumentException("Padding mode must not be empty");
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        // "none" is what older clients send for valid
        if ("none".equals(normalized)) {
            return VALID;
        }
        for (PaddingMode mode : values()) {
            if (mode.key.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown padding mode '" + key + "'");
    }
}
