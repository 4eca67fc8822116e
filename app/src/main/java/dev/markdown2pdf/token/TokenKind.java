package dev.markdown2pdf.token;

public enum TokenKind {
    DOCUMENT(false),
    HEADING(true),
    PARAGRAPH(true),
    EMPHASIS(false),
    CODE_BLOCK(true),
    CODE_SPAN(false),
    LINK(false),
    IMAGE(false),
    LIST(true),
    LIST_ITEM(false),
    BLOCK_QUOTE(true),
    HORIZONTAL_RULE(true),
    TEXT(false),
    LITERAL(false);

    private final boolean block;

    TokenKind(boolean block) {
        this.block = block;
    }

    /**
     * Whether tokens of this kind are separated from their surroundings by block breaks.
     */
    public boolean isBlock() {
        return block;
    }
}
