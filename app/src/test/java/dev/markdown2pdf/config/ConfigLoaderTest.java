package dev.markdown2pdf.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import dev.markdown2pdf.cli.CliArguments;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class ConfigLoaderTest {

    @Test
    void assemblesConfigFromCliArguments() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--path", "docs/readme.md",
                "--output", "build/readme.pdf",
                "--style", "styles/report.toml",
                "--log-format", "json",
                "--verbose");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.source()).isEqualTo(new MarkdownSource(SourceType.PATH, Path.of("docs/readme.md").toString()));
        assertThat(config.outputPath()).isEqualTo(Path.of("build/readme.pdf"));
        assertThat(config.stylePath()).isEqualTo(Path.of("styles/report.toml"));
        assertThat(config.styleExplicit()).isTrue();
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.verbose()).isTrue();
    }

    @Test
    void fallsBackToEnvironmentValuesWhenCliOmitted() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_OUTPUT, "/tmp/out.pdf",
                ConfigLoader.ENV_STYLE, "/etc/markdown2pdf/style.toml",
                ConfigLoader.ENV_LOG_FORMAT, "json"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--string", "# Hi");

        Config config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.source()).isEqualTo(new MarkdownSource(SourceType.STRING, "# Hi"));
        assertThat(config.outputPath()).isEqualTo(Path.of("/tmp/out.pdf"));
        assertThat(config.stylePath()).isEqualTo(Path.of("/etc/markdown2pdf/style.toml"));
        assertThat(config.styleExplicit()).isTrue();
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.verbose()).isFalse();
        assertThat(environmentReader.requestedKeys()).doesNotContain(ConfigLoader.ENV_HOME);
    }

    @Test
    void usesDefaultsWhenNothingIsConfigured() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_HOME, "/home/writer"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "-s", "text");

        Config config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.outputPath()).isEqualTo(Path.of(ConfigLoader.DEFAULT_OUTPUT));
        assertThat(config.stylePath()).isEqualTo(Path.of("/home/writer", ConfigLoader.STYLE_FILE_NAME));
        assertThat(config.styleExplicit()).isFalse();
        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
        assertThat(environmentReader.requestedKeys())
                .contains(ConfigLoader.ENV_OUTPUT, ConfigLoader.ENV_STYLE, ConfigLoader.ENV_HOME);
    }

    @Test
    void looksForStyleInWorkingDirectoryWithoutHome() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "-s", "text");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.stylePath()).isEqualTo(Path.of(ConfigLoader.STYLE_FILE_NAME));
    }

    @Test
    void blankEnvironmentValuesCountAsUnset() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "-s", "text");

        Config config = new ConfigLoader(key -> Optional.of("  ")).load(cliArguments);

        assertThat(config.outputPath()).isEqualTo(Path.of(ConfigLoader.DEFAULT_OUTPUT));
        assertThat(config.stylePath()).isEqualTo(Path.of(ConfigLoader.STYLE_FILE_NAME));
        assertThat(config.styleExplicit()).isFalse();
        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
    }

    @Test
    void cliOutputOverridesEnvironment() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "-s", "text", "-o", "cli.pdf");

        EnvironmentReader environmentReader = key -> ConfigLoader.ENV_OUTPUT.equals(key)
                ? Optional.of("env.pdf")
                : Optional.empty();

        Config config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.outputPath()).isEqualTo(Path.of("cli.pdf"));
    }

    @Test
    void pathWinsOverUrlAndString() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--string", "inline",
                "--url", "https://example.com/doc.md",
                "--path", "doc.md");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.source().type()).isEqualTo(SourceType.PATH);
    }

    @Test
    void urlWinsOverString() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--string", "inline",
                "--url", "https://example.com/doc.md");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.source()).isEqualTo(new MarkdownSource(SourceType.URL, "https://example.com/doc.md"));
    }

    @Test
    void missingInputCausesValidationError() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "-o", "x.pdf");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(ConfigLoader.hasInput(cliArguments)).isFalse();
        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("--path, --url or --string");
    }

    @Test
    void nonHttpUrlCausesValidationError() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--url", "ftp://example.com/doc.md");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("http or https");
    }

    @Test
    void unsupportedLogFormatInEnvironmentIsRejected() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "-s", "text");
        EnvironmentReader environmentReader = key -> ConfigLoader.ENV_LOG_FORMAT.equals(key)
                ? Optional.of("xml")
                : Optional.empty();

        Throwable thrown = catchThrowable(() -> new ConfigLoader(environmentReader).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unsupported log format");
    }

    @Test
    void describesSources() {
        assertThat(new MarkdownSource(SourceType.STRING, "").describe()).isEqualTo("string input (0 chars)");
        assertThat(new MarkdownSource(SourceType.PATH, "a.md").describe()).isEqualTo("file a.md");
        assertThat(catchThrowable(() -> new MarkdownSource(SourceType.URL, " ")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static final class RecordingEnvironmentReader implements EnvironmentReader {

        private final Map<String, String> values;
        private final List<String> requestedKeys = new ArrayList<>();

        private RecordingEnvironmentReader(Map<String, String> values) {
            this.values = values;
        }

        @Override
        public Optional<String> get(String key) {
            requestedKeys.add(key);
            return Optional.ofNullable(values.get(key));
        }

        List<String> requestedKeys() {
            return requestedKeys;
        }
    }
}
