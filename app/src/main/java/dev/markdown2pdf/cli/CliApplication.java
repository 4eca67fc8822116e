package dev.markdown2pdf.cli;

import dev.markdown2pdf.MarkdownConverter;
import dev.markdown2pdf.config.Config;
import dev.markdown2pdf.config.ConfigLoader;
import dev.markdown2pdf.config.EnvironmentReader;
import dev.markdown2pdf.config.StyleTableLoader;
import dev.markdown2pdf.document.StyledDocument;
import dev.markdown2pdf.lexer.ScannerException;
import dev.markdown2pdf.logging.LoggingConfigurator;
import dev.markdown2pdf.render.DocumentRenderer;
import dev.markdown2pdf.render.PdfRenderer;
import dev.markdown2pdf.render.RenderException;
import dev.markdown2pdf.source.InputSourceException;
import dev.markdown2pdf.source.MarkdownSourceReader;
import dev.markdown2pdf.style.StyleMatch;
import dev.markdown2pdf.token.StructuralException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and conversion pipeline.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_INTERNAL_ERROR = 2;
    static final String MDC_SOURCE = "source";

    private final ConfigLoader configLoader;
    private final MarkdownSourceReader sourceReader;
    private final StyleTableLoader styleTableLoader;
    private final MarkdownConverter converter;
    private final DocumentRenderer renderer;
    private final PrintWriter out;
    private final PrintWriter err;

    public CliApplication() {
        this(new ConfigLoader(EnvironmentReader.system()), new MarkdownSourceReader(), new StyleTableLoader(),
                new MarkdownConverter(), new PdfRenderer(),
                new PrintWriter(System.out, true), new PrintWriter(System.err, true));
    }

    CliApplication(ConfigLoader configLoader, MarkdownSourceReader sourceReader, StyleTableLoader styleTableLoader,
                   MarkdownConverter converter, DocumentRenderer renderer, PrintWriter out, PrintWriter err) {
        this.configLoader = configLoader;
        this.sourceReader = sourceReader;
        this.styleTableLoader = styleTableLoader;
        this.converter = converter;
        this.renderer = renderer;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        commandLine.setOut(out);
        commandLine.setErr(err);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }
        if (!ConfigLoader.hasInput(cliArguments)) {
            commandLine.getErr().println("No input given: use --path, --url or --string");
            commandLine.usage(commandLine.getErr());
            return EXIT_FAILURE;
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            return EXIT_FAILURE;
        }
        LoggingConfigurator.configure(config.logFormat(), config.verbose());

        MDC.put(MDC_SOURCE, config.source().describe());
        try {
            String markdown = sourceReader.read(config.source());
            StyleMatch table = styleTableLoader.load(config.stylePath(), config.styleExplicit());
            StyledDocument document = converter.convert(markdown, table);
            renderer.render(document, config.outputPath());
            LOGGER.info("Saved PDF to {}", config.outputPath());
            return EXIT_SUCCESS;
        } catch (InputSourceException | ScannerException | RenderException | UncheckedIOException ex) {
            LOGGER.error("Conversion failed: {}", ex.getMessage());
            return EXIT_FAILURE;
        } catch (StructuralException ex) {
            LOGGER.error("Internal error while assembling the document", ex);
            return EXIT_INTERNAL_ERROR;
        } finally {
            MDC.remove(MDC_SOURCE);
        }
    }
}
