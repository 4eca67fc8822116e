package dev.markdown2pdf.document;

import dev.markdown2pdf.style.ResolvedStyle;
import java.util.Objects;

public record RuleElement(ResolvedStyle style) implements StyledElement {

    public RuleElement {
        Objects.requireNonNull(style, "style");
    }
}
