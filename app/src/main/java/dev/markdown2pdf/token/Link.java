package dev.markdown2pdf.token;

import dev.markdown2pdf.style.Style;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A hyperlink. The label is tokenized inline content; the optional style override is applied on top of the
 * resolved style of every label span.
 */
public record Link(List<Token> label, String url, Optional<Style> styleOverride) implements Token {

    public Link {
        label = List.copyOf(Objects.requireNonNull(label, "label"));
        Objects.requireNonNull(url, "url");
        if (url.isBlank()) {
            throw new IllegalArgumentException("url must not be blank");
        }
        styleOverride = styleOverride == null ? Optional.empty() : styleOverride;
    }

    public Link(List<Token> label, String url) {
        this(label, url, Optional.empty());
    }

    @Override
    public TokenKind kind() {
        return TokenKind.LINK;
    }

    @Override
    public String kindKey() {
        return "link";
    }

    @Override
    public List<Token> children() {
        return label;
    }

    @Override
    public Optional<Style> inlineStyle() {
        return styleOverride;
    }
}
