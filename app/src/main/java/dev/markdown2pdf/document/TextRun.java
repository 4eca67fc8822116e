package dev.markdown2pdf.document;

import dev.markdown2pdf.style.ResolvedStyle;
import java.util.Objects;

public record TextRun(String text, ResolvedStyle style) implements StyledElement {

    public TextRun {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(style, "style");
    }
}
