package dev.markdown2pdf.style;

import java.util.Locale;

/**
 * Horizontal alignment of the lines of a block.
 */
public enum TextAlignment {
    LEFT,
    CENTER,
    RIGHT,
    JUSTIFY;

    /**
     * Parses an alignment name. Unknown or blank names fall back to {@link #LEFT}.
     */
    public static TextAlignment from(String value) {
        if (value == null || value.isBlank()) {
            return LEFT;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "center" -> CENTER;
            case "right" -> RIGHT;
            case "justify" -> JUSTIFY;
            default -> LEFT;
        };
    }
}
