package dev.markdown2pdf.render;

import dev.markdown2pdf.document.StyledDocument;
import dev.markdown2pdf.document.StyledElement;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders a styled document as a PDF with Apache PDFBox, using the standard 14 fonts.
 */
public class PdfRenderer implements DocumentRenderer {

    private static final Logger LOGGER = LoggerFactory.getLogger(PdfRenderer.class);

    @Override
    public void render(StyledDocument document, Path output) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(output, "output");
        try (PDDocument pdf = new PDDocument()) {
            PdfPageWriter writer = new PdfPageWriter(pdf, new PdfFonts(), document.margins());
            for (StyledElement element : document.elements()) {
                writer.write(element);
            }
            int pages = writer.finish();
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            pdf.save(output.toFile());
            LOGGER.debug("Rendered {} elements on {} pages to {}", document.elements().size(), pages, output);
        } catch (IOException ex) {
            throw new RenderException("Failed to render PDF to " + output, ex);
        }
    }
}
