package dev.markdown2pdf.token;

import java.util.List;
import java.util.Objects;

/**
 * Emphasized content. The level is the total length of the emphasis runs enclosing the content, this one
 * included: 1 is italic, 2 bold, 3 and above bold italic.
 */
public record Emphasis(int level, List<Token> children) implements Token {

    public Emphasis {
        if (level < 1) {
            throw new IllegalArgumentException("Emphasis level must be positive but was " + level);
        }
        children = List.copyOf(Objects.requireNonNull(children, "children"));
    }

    @Override
    public TokenKind kind() {
        return TokenKind.EMPHASIS;
    }

    @Override
    public String kindKey() {
        return switch (level) {
            case 1 -> "italic";
            case 2 -> "bold";
            default -> "bold-italic";
        };
    }
}
