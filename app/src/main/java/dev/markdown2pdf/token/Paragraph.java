package dev.markdown2pdf.token;

import java.util.List;
import java.util.Objects;

public record Paragraph(List<Token> children) implements Token {

    public Paragraph {
        children = List.copyOf(Objects.requireNonNull(children, "children"));
    }

    @Override
    public TokenKind kind() {
        return TokenKind.PARAGRAPH;
    }

    @Override
    public String kindKey() {
        return "paragraph";
    }
}
