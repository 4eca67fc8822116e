package dev.markdown2pdf.token;

import java.util.List;
import java.util.Objects;

public record Document(List<Token> children) implements Token {

    public Document {
        children = List.copyOf(Objects.requireNonNull(children, "children"));
    }

    @Override
    public TokenKind kind() {
        return TokenKind.DOCUMENT;
    }

    @Override
    public String kindKey() {
        return "document";
    }
}
