package dev.markdown2pdf.token;

import java.util.List;
import java.util.Objects;

public record ListItem(List<Token> children) implements Token {

    public ListItem {
        children = List.copyOf(Objects.requireNonNull(children, "children"));
    }

    @Override
    public TokenKind kind() {
        return TokenKind.LIST_ITEM;
    }

    @Override
    public String kindKey() {
        return "list-item";
    }
}
