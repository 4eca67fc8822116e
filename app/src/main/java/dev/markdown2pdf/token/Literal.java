package dev.markdown2pdf.token;

import java.util.Objects;

/**
 * Source text of a construct that could not be completed, such as an unmatched emphasis run or a bracket
 * without a target.
 */
public record Literal(String content) implements Token {

    public Literal {
        Objects.requireNonNull(content, "content");
    }

    @Override
    public TokenKind kind() {
        return TokenKind.LITERAL;
    }

    @Override
    public String kindKey() {
        return "literal";
    }
}
