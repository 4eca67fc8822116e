package dev.markdown2pdf.token;

import java.util.Objects;

public record Text(String content) implements Token {

    public Text {
        Objects.requireNonNull(content, "content");
    }

    @Override
    public TokenKind kind() {
        return TokenKind.TEXT;
    }

    @Override
    public String kindKey() {
        return "text";
    }
}
