package dev.markdown2pdf.document;

import dev.markdown2pdf.style.Margins;
import java.util.List;
import java.util.Objects;

public record StyledDocument(List<StyledElement> elements, Margins margins) {

    public StyledDocument {
        elements = List.copyOf(Objects.requireNonNull(elements, "elements"));
        Objects.requireNonNull(margins, "margins");
    }
}
