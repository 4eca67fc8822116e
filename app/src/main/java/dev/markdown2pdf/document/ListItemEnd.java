package dev.markdown2pdf.document;

public record ListItemEnd(int depth) implements StyledElement {

    public ListItemEnd {
        if (depth < 1) {
            throw new IllegalArgumentException("depth must be positive");
        }
    }
}
