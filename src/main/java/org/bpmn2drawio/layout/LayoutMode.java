package org.bpmn2drawio.layout;

import java.util.Locale;

public enum LayoutMode {
    /**
     * Compute positions from the flow graph. Elements that already have
     * diagram interchange coordinates keep them.
     */
    AUTO,
    /** Keep the diagram interchange coordinates of the input. */
    PRESERVE;

    /**
     * Accepts {@code auto}, {@code preserve} and {@code graphviz}, the latter
     * being an older name for automatic layout.
     */
    public static LayoutMode parse(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "auto", "graphviz" -> AUTO;
            case "preserve" -> PRESERVE;
            default -> throw new IllegalArgumentException(
                    "Unknown layout mode '" + value + "', expected auto or preserve");
        };
    }
}
