package dev.markdown2pdf.render;

/**
 * Runtime exception used to propagate rendering failures.
 */
public class RenderException extends RuntimeException {

    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
