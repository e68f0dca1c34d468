package org.bpmn2drawio.layout;

import java.util.Locale;

/**
 * Page format written to the diagram. Its landscape width doubles as the
 * wrapping width for rows of unconnected elements; {@link #AUTO} never wraps.
 */
public enum PageSize {
    AUTO(850, 1100),
    A4(827, 1169),
    LETTER(850, 1100);

    private final int pageWidth;
    private final int pageHeight;

    PageSize(int pageWidth, int pageHeight) {
        this.pageWidth = pageWidth;
        this.pageHeight = pageHeight;
    }

    public int pageWidth() {
        return pageWidth;
    }

    public int pageHeight() {
        return pageHeight;
    }

    /** Width at which trailing rows wrap, 0 for none. */
    public double wrapWidth() {
        return this == AUTO ? 0 : Math.max(pageWidth, pageHeight);
    }

    public static PageSize parse(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "auto" -> AUTO;
            case "a4" -> A4;
            case "letter" -> LETTER;
            default -> throw new IllegalArgumentException(
                    "Unknown page size '" + value + "', expected A4, letter or auto");
        };
    }
}
