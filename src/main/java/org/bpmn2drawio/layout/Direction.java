package org.bpmn2drawio.layout;

import java.util.Locale;

/**
 * Main flow direction of the diagram.
 */
public enum Direction {
    LR,
    TB,
    RL,
    BT;

    /** Rank runs along the y axis. */
    public boolean isVertical() {
        return this == TB || this == BT;
    }

    /** Rank runs against the axis (right to left, bottom to top). */
    public boolean isReversed() {
        return this == RL || this == BT;
    }

    public static Direction parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown direction '" + value + "', expected one of LR, TB, RL, BT", e);
        }
    }
}
