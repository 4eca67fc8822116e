package dev.markdown2pdf.document;

import dev.markdown2pdf.style.ResolvedStyle;
import java.util.Objects;
import java.util.Optional;

/**
 * Verbatim code. The language is a hint for the renderer only.
 */
public record CodeBlockElement(Optional<String> language, String content, ResolvedStyle style)
        implements StyledElement {

    public CodeBlockElement {
        language = language == null ? Optional.empty() : language;
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(style, "style");
    }
}
