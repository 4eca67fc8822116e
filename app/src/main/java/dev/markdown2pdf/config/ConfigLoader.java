package dev.markdown2pdf.config;

import dev.markdown2pdf.cli.CliArguments;
import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 *
 * <p>When several inputs are given the first of path, url and string wins and the others are ignored.
 */
public class ConfigLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigLoader.class);

    static final String ENV_OUTPUT = "MARKDOWN2PDF_OUTPUT";
    static final String ENV_STYLE = "MARKDOWN2PDF_STYLE";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_HOME = "HOME";

    static final String DEFAULT_OUTPUT = "output.pdf";
    static final String STYLE_FILE_NAME = "markdown2pdfrc.toml";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        MarkdownSource source = resolveSource(arguments);
        Path outputPath = Path.of(firstNonBlank(arguments.output(), ENV_OUTPUT, DEFAULT_OUTPUT));

        Path stylePath;
        boolean styleExplicit;
        if (arguments.style() != null) {
            stylePath = arguments.style();
            styleExplicit = true;
        } else {
            String fromEnvironment = environmentReader.nonBlank(ENV_STYLE).orElse(null);
            styleExplicit = fromEnvironment != null;
            stylePath = styleExplicit ? Path.of(fromEnvironment) : defaultStylePath();
        }

        return new Config(source, outputPath, stylePath, styleExplicit, resolveLogFormat(arguments), arguments.verbose());
    }

    /**
     * Whether the arguments name any Markdown input at all.
     */
    public static boolean hasInput(CliArguments arguments) {
        return arguments.path() != null || arguments.url() != null || arguments.string() != null;
    }

    private MarkdownSource resolveSource(CliArguments arguments) {
        List<MarkdownSource> given = new ArrayList<>();
        if (arguments.path() != null) {
            given.add(new MarkdownSource(SourceType.PATH, arguments.path().toString()));
        }
        if (arguments.url() != null) {
            given.add(new MarkdownSource(SourceType.URL, arguments.url().toString()));
        }
        if (arguments.string() != null) {
            given.add(new MarkdownSource(SourceType.STRING, arguments.string()));
        }
        if (given.isEmpty()) {
            throw new IllegalArgumentException("One of --path, --url or --string must be provided");
        }
        MarkdownSource selected = given.get(0);
        if (given.size() > 1) {
            LOGGER.warn("Several inputs given; using {} and ignoring the rest", selected.describe());
        }
        if (selected.type() == SourceType.URL) {
            requireHttpUrl(arguments.url());
        }
        return selected;
    }

    private static void requireHttpUrl(URI url) {
        String scheme = url.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
            throw new IllegalArgumentException("--url must be an http or https URL: " + url);
        }
    }

    private Path defaultStylePath() {
        return environmentReader.nonBlank(ENV_HOME)
                .map(home -> Path.of(home, STYLE_FILE_NAME))
                .orElse(Path.of(STYLE_FILE_NAME));
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.nonBlank(ENV_LOG_FORMAT)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private String firstNonBlank(String cliValue, String envKey, String defaultValue) {
        if (isNotBlank(cliValue)) {
            return cliValue;
        }
        return environmentReader.nonBlank(envKey).orElse(defaultValue);
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
