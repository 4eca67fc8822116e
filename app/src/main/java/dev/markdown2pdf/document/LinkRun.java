package dev.markdown2pdf.document;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A hyperlink and its label spans, kept together so the clickable region covers exactly the label.
 */
public record LinkRun(String url, List<TextRun> spans) implements StyledElement {

    public LinkRun {
        Objects.requireNonNull(url, "url");
        spans = List.copyOf(Objects.requireNonNull(spans, "spans"));
        if (url.isBlank()) {
            throw new IllegalArgumentException("url must not be blank");
        }
        if (spans.isEmpty()) {
            throw new IllegalArgumentException("A link needs at least one span");
        }
    }

    public String text() {
        return spans.stream().map(TextRun::text).collect(Collectors.joining());
    }
}
