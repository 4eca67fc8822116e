package dev.markdown2pdf.cli;

import dev.markdown2pdf.config.LogFormat;
import java.net.URI;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "markdown2pdf", mixinStandardHelpOptions = true, version = "markdown2pdf 0.1.0",
        description = "Converts Markdown to PDF")
public class CliArguments {

    @CommandLine.Option(names = {"-p", "--path"}, description = "Path to the Markdown file", paramLabel = "FILE")
    private Path path;

    @CommandLine.Option(names = {"-u", "--url"}, description = "URL of a Markdown document to fetch", paramLabel = "URL")
    private URI url;

    @CommandLine.Option(names = {"-s", "--string"}, description = "Markdown text to convert", paramLabel = "MARKDOWN")
    private String string;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Output PDF path (default: output.pdf)", paramLabel = "FILE")
    private String output;

    @CommandLine.Option(names = "--style", description = "TOML style file (default: ~/markdown2pdfrc.toml)", paramLabel = "FILE")
    private Path style;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log debug output")
    private boolean verbose;

    public Path path() {
        return path;
    }

    public URI url() {
        return url;
    }

    public String string() {
        return string;
    }

    public String output() {
        return output;
    }

    public Path style() {
        return style;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }
}
