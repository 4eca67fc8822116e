package dev.markdown2pdf.lexer;

/**
 * Classification of the spans emitted by the {@link Scanner}.
 */
public enum UnitKind {
    TEXT,
    RAW_TEXT,
    NEWLINE,
    HEADING_MARKER,
    EMPHASIS_MARKER,
    CODE_FENCE,
    CODE_SPAN,
    LIST_MARKER,
    BLOCK_QUOTE_MARKER,
    HORIZONTAL_RULE,
    LINK_OPEN,
    IMAGE_OPEN,
    LINK_CLOSE,
    LINK_TARGET,
    COMMENT
}
