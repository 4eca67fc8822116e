package dev.markdown2pdf;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.assertj.core.api.Assertions.tuple;

import dev.markdown2pdf.document.LinkRun;
import dev.markdown2pdf.document.StyledDocument;
import dev.markdown2pdf.document.TextRun;
import dev.markdown2pdf.lexer.ScannerException;
import dev.markdown2pdf.style.Margins;
import dev.markdown2pdf.style.StyleMatch;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MarkdownConverterTest {

    private final MarkdownConverter converter = new MarkdownConverter();

    @Test
    void convertsMarkdownIntoStyledElements() {
        StyledDocument document = converter.convert(
                "# Guide\n\nRead [the manual](https://example.com/manual) *carefully*.\n",
                StyleMatch.defaults());

        assertThat(document.margins()).isEqualTo(Margins.defaults());
        assertThat(document.elements()).filteredOn(LinkRun.class::isInstance)
                .map(LinkRun.class::cast)
                .extracting(LinkRun::url, LinkRun::text)
                .containsExactly(tuple("https://example.com/manual", "the manual"));
        assertThat(document.elements()).filteredOn(TextRun.class::isInstance)
                .map(TextRun.class::cast)
                .extracting(TextRun::text)
                .containsExactly("Guide", "Read ", " ", "carefully", ".");
    }

    @Test
    void carriesTableMarginsIntoDocument() {
        Margins margins = new Margins(20, 15, 20, 15);

        StyledDocument document = converter.convert("text", new StyleMatch(Map.of(), margins));

        assertThat(document.margins()).isEqualTo(margins);
    }

    @Test
    void emptyInputGivesEmptyDocument() {
        assertThat(converter.parse("").children()).isEmpty();
        assertThat(converter.convert("", StyleMatch.defaults()).elements()).isEmpty();
    }

    @Test
    void convertsDeeplyNestedEmphasis() {
        int depth = 5000;
        String markdown = "*a ".repeat(depth) + "core" + " a*".repeat(depth);

        StyledDocument document = converter.convert(markdown, StyleMatch.defaults());

        assertThat(document.elements()).filteredOn(TextRun.class::isInstance)
                .map(TextRun.class::cast)
                .filteredOn(run -> run.text().contains("core"))
                .singleElement()
                .satisfies(run -> {
                    assertThat(run.style().bold()).isTrue();
                    assertThat(run.style().italic()).isTrue();
                });
    }

    @Test
    void rejectsMalformedText() {
        Throwable thrown = catchThrowable(() -> converter.convert("bad \uD800 text", StyleMatch.defaults()));

        assertThat(thrown).isInstanceOf(ScannerException.class);
    }
}
