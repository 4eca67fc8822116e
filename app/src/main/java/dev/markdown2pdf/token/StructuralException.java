package dev.markdown2pdf.token;

/**
 * Raised when the unit stream violates an invariant the builder relies on. Malformed Markdown never
 * causes it.
 */
public class StructuralException extends RuntimeException {

    public StructuralException(String message) {
        super(message);
    }
}
