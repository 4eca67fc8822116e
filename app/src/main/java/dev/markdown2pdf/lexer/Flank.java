package dev.markdown2pdf.lexer;

/**
 * Which side of an emphasis run touches non-whitespace text.
 */
public enum Flank {
    NONE,
    OPENING,
    CLOSING,
    BOTH;

    static Flank of(boolean canOpen, boolean canClose) {
        if (canOpen && canClose) {
            return BOTH;
        }
        if (canOpen) {
            return OPENING;
        }
        return canClose ? CLOSING : NONE;
    }

    public boolean canOpen() {
        return this == OPENING || this == BOTH;
    }

    public boolean canClose() {
        return this == CLOSING || this == BOTH;
    }
}
