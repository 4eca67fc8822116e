package dev.markdown2pdf.token;

import java.util.List;
import java.util.Objects;

public record ListBlock(boolean ordered, List<ListItem> items) implements Token {

    public ListBlock {
        items = List.copyOf(Objects.requireNonNull(items, "items"));
    }

    @Override
    public TokenKind kind() {
        return TokenKind.LIST;
    }

    @Override
    public String kindKey() {
        return "list";
    }

    @Override
    public List<Token> children() {
        return List.copyOf(items);
    }
}
