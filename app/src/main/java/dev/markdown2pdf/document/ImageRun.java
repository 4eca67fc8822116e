package dev.markdown2pdf.document;

import dev.markdown2pdf.style.ResolvedStyle;
import java.util.Objects;

/**
 * An image reference. Renderers that do not embed images print the alt text.
 */
public record ImageRun(String alt, String url, ResolvedStyle style) implements StyledElement {

    public ImageRun {
        Objects.requireNonNull(alt, "alt");
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(style, "style");
    }
}
