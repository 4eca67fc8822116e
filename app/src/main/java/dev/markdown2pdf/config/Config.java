package dev.markdown2pdf.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        MarkdownSource source,
        Path outputPath,
        Path stylePath,
        boolean styleExplicit,
        LogFormat logFormat,
        boolean verbose
) {

    public Config {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(outputPath, "outputPath");
        Objects.requireNonNull(stylePath, "stylePath");
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
    }
}
