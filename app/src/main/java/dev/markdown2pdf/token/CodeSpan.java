package dev.markdown2pdf.token;

import java.util.Objects;

public record CodeSpan(String content) implements Token {

    public CodeSpan {
        Objects.requireNonNull(content, "content");
    }

    @Override
    public TokenKind kind() {
        return TokenKind.CODE_SPAN;
    }

    @Override
    public String kindKey() {
        return "code-span";
    }
}
