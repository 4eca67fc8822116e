package dev.markdown2pdf.token;

import java.util.List;
import java.util.Objects;

public record BlockQuote(List<Token> children) implements Token {

    public BlockQuote {
        children = List.copyOf(Objects.requireNonNull(children, "children"));
    }

    @Override
    public TokenKind kind() {
        return TokenKind.BLOCK_QUOTE;
    }

    @Override
    public String kindKey() {
        return "block-quote";
    }
}
