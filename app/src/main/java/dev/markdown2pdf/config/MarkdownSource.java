package dev.markdown2pdf.config;

import java.util.Locale;
import java.util.Objects;

/**
 * The Markdown input selected on the command line: a file path, a URL or the literal text.
 */
public record MarkdownSource(SourceType type, String value) {

    public MarkdownSource {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(value, "value");
        if (type != SourceType.STRING && value.isBlank()) {
            throw new IllegalArgumentException(type.name().toLowerCase(Locale.ROOT) + " source must not be blank");
        }
    }

    /**
     * Short human-readable description, used in log messages.
     */
    public String describe() {
        return switch (type) {
            case PATH -> "file " + value;
            case URL -> "url " + value;
            case STRING -> "string input (" + value.length() + " chars)";
        };
    }
}
