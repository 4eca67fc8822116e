package dev.markdown2pdf.token;

import dev.markdown2pdf.style.Style;
import java.util.List;
import java.util.Optional;

/**
 * A node of the document tree. Implementations are immutable records.
 */
public interface Token {

    TokenKind kind();

    /**
     * The key under which this token's style is looked up, for example {@code "heading-2"} or {@code "bold"}.
     */
    String kindKey();

    default List<Token> children() {
        return List.of();
    }

    default Optional<Style> inlineStyle() {
        return Optional.empty();
    }
}
