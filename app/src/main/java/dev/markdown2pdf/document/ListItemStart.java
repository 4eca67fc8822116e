package dev.markdown2pdf.document;

import dev.markdown2pdf.style.ResolvedStyle;
import java.util.Objects;

/**
 * Opens the indent scope of a list item. Depth starts at 1 for a top-level list.
 */
public record ListItemStart(int depth, String marker, ResolvedStyle style) implements StyledElement {

    public ListItemStart {
        if (depth < 1) {
            throw new IllegalArgumentException("depth must be positive");
        }
        Objects.requireNonNull(marker, "marker");
        Objects.requireNonNull(style, "style");
    }
}
