package dev.markdown2pdf.token;

import java.util.Objects;

public record Image(String alt, String url) implements Token {

    public Image {
        Objects.requireNonNull(alt, "alt");
        Objects.requireNonNull(url, "url");
    }

    @Override
    public TokenKind kind() {
        return TokenKind.IMAGE;
    }

    @Override
    public String kindKey() {
        return "image";
    }
}
