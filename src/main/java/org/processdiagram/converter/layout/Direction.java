package org.processdiagram.converter.layout;

import java.util.Locale;

/**
 * Direction in which ranks advance.
 */
public enum Direction {
    LR,
    TB,
    RL,
    BT;

    /**
     * Ranks advance along x.
     */
    public boolean isHorizontal() {
        return this == LR || this == RL;
    }

    /**
     * Ranks advance towards smaller coordinates.
     */
    public boolean isReversed() {
        return this == RL || this == BT;
    }

    public static Direction fromValue(String value) {
        try {
            return Direction.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown direction '" + value + "', expected one of LR, TB, RL, BT", e);
        }
    }
}
