package dev.markdown2pdf.token;

public record HorizontalRule() implements Token {

    @Override
    public TokenKind kind() {
        return TokenKind.HORIZONTAL_RULE;
    }

    @Override
    public String kindKey() {
        return "horizontal-rule";
    }
}
