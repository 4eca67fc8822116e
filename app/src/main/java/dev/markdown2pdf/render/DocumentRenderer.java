package dev.markdown2pdf.render;

import dev.markdown2pdf.document.StyledDocument;
import java.nio.file.Path;

/**
 * Writes a styled document to a file.
 */
public interface DocumentRenderer {

    void render(StyledDocument document, Path output);
}
