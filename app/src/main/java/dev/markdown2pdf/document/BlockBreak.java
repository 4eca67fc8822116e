package dev.markdown2pdf.document;

import dev.markdown2pdf.style.ResolvedStyle;
import java.util.Objects;

/**
 * Marks the start or the end of a block. The style is the block's own resolved style, whose after-spacing
 * the renderer applies at the {@link Edge#AFTER} edge.
 */
public record BlockBreak(String blockKey, Edge edge, ResolvedStyle style) implements StyledElement {

    public enum Edge {
        BEFORE,
        AFTER
    }

    public BlockBreak {
        Objects.requireNonNull(blockKey, "blockKey");
        Objects.requireNonNull(edge, "edge");
        Objects.requireNonNull(style, "style");
    }
}
