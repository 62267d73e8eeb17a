package com.familygraph.layout;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Which screen axis carries the generations.
 */
public enum LayoutDirection {
    TOP_DOWN("top-down"),
    LEFT_RIGHT("left-right");

    private final String value;

    LayoutDirection(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static LayoutDirection fromValue(String value) {
        if (value == null || value.isBlank()) {
            return TOP_DOWN;
        }
        return Arrays.stream(values())
                .filter(d -> d.value.equalsIgnoreCase(value) || d.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown layout direction: " + value));
    }
}
