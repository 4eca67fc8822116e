package dev.markdown2pdf.token;

import java.util.List;
import java.util.Objects;

public record Heading(int level, List<Token> children) implements Token {

    public Heading {
        if (level < 1 || level > 6) {
            throw new IllegalArgumentException("Heading level must be between 1 and 6 but was " + level);
        }
        children = List.copyOf(Objects.requireNonNull(children, "children"));
    }

    @Override
    public TokenKind kind() {
        return TokenKind.HEADING;
    }

    @Override
    public String kindKey() {
        return "heading-" + level;
    }
}
