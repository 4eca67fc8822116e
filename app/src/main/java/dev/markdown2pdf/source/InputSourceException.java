package dev.markdown2pdf.source;

/**
 * Runtime exception raised when the Markdown input cannot be obtained.
 */
public class InputSourceException extends RuntimeException {

    public InputSourceException(String message) {
        super(message);
    }

    public InputSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
