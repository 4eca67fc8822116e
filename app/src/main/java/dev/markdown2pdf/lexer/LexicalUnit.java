package dev.markdown2pdf.lexer;

import java.util.Objects;

/**
 * A classified span of the input text.
 */
public record LexicalUnit(UnitKind kind, String text, int offset, Flank flank) {

    public LexicalUnit {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(flank, "flank");
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
    }

    public static LexicalUnit of(UnitKind kind, String text, int offset) {
        return new LexicalUnit(kind, text, offset, Flank.NONE);
    }

    public boolean is(UnitKind other) {
        return kind == other;
    }

    /**
     * Width of the leading spaces and tabs of this unit's text, tabs advancing to the next multiple of four.
     */
    public int indentWidth() {
        int width = 0;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == ' ') {
                width++;
            } else if (ch == '\t') {
                width += 4 - (width % 4);
            } else {
                break;
            }
        }
        return width;
    }
}
