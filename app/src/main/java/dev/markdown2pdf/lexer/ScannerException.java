package dev.markdown2pdf.lexer;

/**
 * Raised when the input text cannot be scanned at all, as opposed to merely being malformed Markdown.
 */
public class ScannerException extends RuntimeException {

    private final int offset;

    public ScannerException(String message, int offset) {
        super(message + " at offset " + offset);
        this.offset = offset;
    }

    public int offset() {
        return offset;
    }
}
