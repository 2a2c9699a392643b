package org.processdiagram.converter.layout;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;

public enum LayoutMode {
    /**
     * Keep the geometry of the source diagram, repairing containment only.
     */
    @JsonProperty("preserve")
    PRESERVE("preserve"),

    /**
     * Compute a fresh layered layout.
     */
    @JsonProperty("compute")
    COMPUTE("compute");

    private final String value;

    LayoutMode(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static LayoutMode fromValue(String value) {
        return Arrays.stream(values())
                .filter(mode -> mode.value.equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown layout mode '" + value + "', expected 'preserve' or 'compute'"));
    }
}
