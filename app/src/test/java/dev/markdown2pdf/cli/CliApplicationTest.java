package dev.markdown2pdf.cli;

import static org.assertj.core.api.Assertions.assertThat;

import dev.markdown2pdf.MarkdownConverter;
import dev.markdown2pdf.config.ConfigLoader;
import dev.markdown2pdf.config.MarkdownSource;
import dev.markdown2pdf.config.StyleTableLoader;
import dev.markdown2pdf.document.StyledDocument;
import dev.markdown2pdf.document.TextRun;
import dev.markdown2pdf.render.DocumentRenderer;
import dev.markdown2pdf.render.PdfRenderer;
import dev.markdown2pdf.source.InputSourceException;
import dev.markdown2pdf.source.MarkdownSourceReader;
import dev.markdown2pdf.style.StyleMatch;
import dev.markdown2pdf.token.StructuralException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CliApplicationTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @Test
    void convertsStringInputAndRendersToOutputPath() {
        RecordingRenderer renderer = new RecordingRenderer();
        Path output = tempDir.resolve("out.pdf");

        int exitCode = application(new MarkdownConverter(), renderer).run(new String[] {
                "--string", "# Hello\n\nworld",
                "--output", output.toString(),
                "--style", tempDir.resolve("none.toml").toString()
        });

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_SUCCESS);
        assertThat(renderer.invocationCount).isEqualTo(1);
        assertThat(renderer.output).isEqualTo(output);
        assertThat(renderer.document.elements()).filteredOn(TextRun.class::isInstance)
                .map(TextRun.class::cast)
                .extracting(TextRun::text)
                .containsExactly("Hello", "world");
    }

    @Test
    void writesPdfWithDefaultRenderer() {
        Path output = tempDir.resolve("pdf/out.pdf");

        int exitCode = application(new MarkdownConverter(), new PdfRenderer()).run(new String[] {
                "-s", "*styled* text", "-o", output.toString(), "--style", tempDir.resolve("none.toml").toString()
        });

        assertThat(exitCode).isZero();
        assertThat(output).exists().isNotEmptyFile();
    }

    @Test
    void missingInputPrintsUsage() {
        RecordingRenderer renderer = new RecordingRenderer();

        int exitCode = application(new MarkdownConverter(), renderer).run(new String[] {"-o", "x.pdf"});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_FAILURE);
        assertThat(err.toString()).contains("No input given").contains("Usage:");
        assertThat(renderer.invocationCount).isZero();
    }

    @Test
    void unknownOptionIsRejected() {
        int exitCode = application(new MarkdownConverter(), new RecordingRenderer()).run(new String[] {"--bogus"});

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("--bogus");
    }

    @Test
    void unknownLogFormatIsRejected() {
        int exitCode = application(new MarkdownConverter(), new RecordingRenderer())
                .run(new String[] {"-s", "text", "--log-format", "xml"});

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("Unsupported log format");
    }

    @Test
    void helpIsPrintedToOut() {
        int exitCode = application(new MarkdownConverter(), new RecordingRenderer()).run(new String[] {"--help"});

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("markdown2pdf", "--path", "--url", "--string");
    }

    @Test
    void invalidUrlFailsBeforeReading() {
        int exitCode = application(new MarkdownConverter(), new RecordingRenderer())
                .run(new String[] {"--url", "file:///etc/passwd"});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_FAILURE);
        assertThat(err.toString()).contains("http or https");
    }

    @Test
    void unreadableInputFails() {
        RecordingRenderer renderer = new RecordingRenderer();

        int exitCode = application(new MarkdownConverter(), renderer).run(new String[] {
                "--path", tempDir.resolve("absent.md").toString(),
                "--style", tempDir.resolve("none.toml").toString()
        });

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_FAILURE);
        assertThat(renderer.invocationCount).isZero();
    }

    @Test
    void structuralFailureIsReportedAsInternalError() {
        RecordingRenderer renderer = new RecordingRenderer();

        int exitCode = application(new FailingConverter(), renderer).run(new String[] {
                "-s", "text", "--style", tempDir.resolve("none.toml").toString()
        });

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_INTERNAL_ERROR);
        assertThat(renderer.invocationCount).isZero();
    }

    @Test
    void sourceFailureFromReaderIsReported() {
        MarkdownSourceReader failingReader = new MarkdownSourceReader() {
            @Override
            public String read(MarkdownSource source) {
                throw new InputSourceException("Fetching " + source.value() + " returned status 500");
            }
        };
        CliApplication application = new CliApplication(new ConfigLoader(key -> Optional.empty()), failingReader,
                new StyleTableLoader(), new MarkdownConverter(), new RecordingRenderer(),
                new PrintWriter(out, true), new PrintWriter(err, true));

        int exitCode = application.run(new String[] {"--url", "https://example.com/doc.md"});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_FAILURE);
    }

    private CliApplication application(MarkdownConverter converter, DocumentRenderer renderer) {
        return new CliApplication(new ConfigLoader(key -> Optional.empty()), new MarkdownSourceReader(),
                new StyleTableLoader(), converter, renderer, new PrintWriter(out, true), new PrintWriter(err, true));
    }

    private static final class RecordingRenderer implements DocumentRenderer {

        private int invocationCount;
        private StyledDocument document;
        private Path output;

        @Override
        public void render(StyledDocument document, Path output) {
            invocationCount++;
            this.document = document;
            this.output = output;
        }
    }

    private static final class FailingConverter extends MarkdownConverter {

        @Override
        public StyledDocument convert(String markdown, StyleMatch table) {
            throw new StructuralException("Unit stream exhausted after 3 units");
        }
    }
}
