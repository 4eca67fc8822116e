package dev.markdown2pdf.document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import dev.markdown2pdf.style.Color;
import dev.markdown2pdf.style.Margins;
import dev.markdown2pdf.style.Style;
import dev.markdown2pdf.style.StyleMatch;
import dev.markdown2pdf.token.CodeBlock;
import dev.markdown2pdf.token.Document;
import dev.markdown2pdf.token.Emphasis;
import dev.markdown2pdf.token.Heading;
import dev.markdown2pdf.token.HorizontalRule;
import dev.markdown2pdf.token.Image;
import dev.markdown2pdf.token.Link;
import dev.markdown2pdf.token.ListBlock;
import dev.markdown2pdf.token.ListItem;
import dev.markdown2pdf.token.Paragraph;
import dev.markdown2pdf.token.Text;
import dev.markdown2pdf.token.Token;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class DocumentBuilderTest {

    private static final Color RED = new Color(200, 0, 0);

    private final DocumentBuilder builder = new DocumentBuilder();

    @Test
    void framesEveryBlockWithBreaks() {
        List<StyledElement> elements = build(
                new Heading(1, List.of(new Text("Title"))),
                new Paragraph(List.of(new Text("Body"))),
                new HorizontalRule());

        assertThat(describe(elements)).containsExactly(
                "before:heading-1", "text:Title", "after:heading-1",
                "before:paragraph", "text:Body", "after:paragraph",
                "before:horizontal-rule", "rule", "after:horizontal-rule");
    }

    @Test
    void styleFlowsFromBlockToRuns() {
        List<StyledElement> elements = build(
                new Heading(2, List.of(new Text("Sub"))),
                new Paragraph(List.of(new Text("plain "), new Emphasis(2, List.of(new Text("strong"))))));

        assertThat(elements).filteredOn(TextRun.class::isInstance)
                .map(TextRun.class::cast)
                .extracting(TextRun::text, run -> run.style().size(), run -> run.style().bold())
                .containsExactly(
                        tuple("Sub", 20.0, true),
                        tuple("plain ", 12.0, false),
                        tuple("strong", 12.0, true));
    }

    @Test
    void numbersEachOrderedListFromOne() {
        List<StyledElement> elements = build(
                new ListBlock(true, List.of(item("one"), item("two"))),
                new ListBlock(true, List.of(item("three"))));

        assertThat(elements).filteredOn(ListItemStart.class::isInstance)
                .map(ListItemStart.class::cast)
                .extracting(ListItemStart::marker, ListItemStart::depth)
                .containsExactly(tuple("1.", 1), tuple("2.", 1), tuple("1.", 1));
    }

    @Test
    void nestsListItemsWithDepth() {
        ListBlock inner = new ListBlock(false, List.of(item("b")));
        List<StyledElement> elements = build(new ListBlock(false, List.of(
                new ListItem(List.of(new Text("a"), inner)),
                item("c"))));

        assertThat(describe(elements)).containsExactly(
                "before:list",
                "item:1:" + DocumentBuilder.BULLET, "text:a",
                "before:list", "item:2:" + DocumentBuilder.BULLET, "text:b", "end:2", "after:list",
                "end:1",
                "item:1:" + DocumentBuilder.BULLET, "text:c", "end:1",
                "after:list");
    }

    @Test
    void keepsLinkLabelTogether() {
        Link link = new Link(List.of(new Text("the "), new Emphasis(2, List.of(new Text("docs")))),
                "https://example.com");

        List<StyledElement> elements = build(new Paragraph(List.of(new Text("see "), link)));

        LinkRun run = (LinkRun) elements.get(2);
        assertThat(run.url()).isEqualTo("https://example.com");
        assertThat(run.text()).isEqualTo("the docs");
        assertThat(run.spans())
                .extracting(TextRun::text, span -> span.style().bold(), span -> span.style().underline())
                .containsExactly(tuple("the ", false, true), tuple("docs", true, true));
    }

    @Test
    void emptyLinkLabelFallsBackToUrl() {
        List<StyledElement> elements = build(new Paragraph(List.of(new Link(List.of(), "https://example.com"))));

        LinkRun run = (LinkRun) elements.get(1);
        assertThat(run.spans()).extracting(TextRun::text).containsExactly("https://example.com");
    }

    @Test
    void urlFallbackTakesLinkOverride() {
        Link link = new Link(List.of(), "https://example.com", Optional.of(Style.builder().textColor(RED).build()));

        List<StyledElement> elements = build(new Paragraph(List.of(link)));

        LinkRun run = (LinkRun) elements.get(1);
        assertThat(run.spans())
                .extracting(TextRun::text, span -> span.style().textColor())
                .containsExactly(tuple("https://example.com", RED));
    }

    @Test
    void linkOverrideAppliesToEverySpan() {
        Link link = new Link(List.of(new Text("a"), new Emphasis(1, List.of(new Text("b")))), "u",
                Optional.of(Style.builder().textColor(RED).build()));

        List<StyledElement> elements = build(new Paragraph(List.of(link)));

        LinkRun run = (LinkRun) elements.get(1);
        assertThat(run.spans()).extracting(span -> span.style().textColor()).containsOnly(RED);
        assertThat(run.spans().get(1).style().italic()).isTrue();
    }

    @Test
    void emitsCodeBlocksAndImages() {
        List<StyledElement> elements = build(
                new CodeBlock(Optional.of("java"), "int x;\n"),
                new Paragraph(List.of(new Image("logo", "logo.png"))));

        CodeBlockElement code = (CodeBlockElement) elements.get(1);
        assertThat(code.language()).contains("java");
        assertThat(code.content()).isEqualTo("int x;\n");
        assertThat(code.style().fontFamily()).isEqualTo("courier");
        ImageRun image = (ImageRun) elements.get(4);
        assertThat(image.alt()).isEqualTo("logo");
        assertThat(image.url()).isEqualTo("logo.png");
    }

    @Test
    void appliesTableEntries() {
        StyleMatch table = new StyleMatch(
                Map.of("list-item.text", Style.builder().textColor(RED).build()), Margins.defaults());

        List<StyledElement> elements = builder.build(new Document(List.of(
                new Paragraph(List.of(new Text("outside"))),
                new ListBlock(false, List.of(item("inside"))))), table);

        assertThat(elements).filteredOn(TextRun.class::isInstance)
                .map(TextRun.class::cast)
                .extracting(TextRun::text, run -> run.style().textColor())
                .containsExactly(tuple("outside", Color.BLACK), tuple("inside", RED));
    }

    private List<StyledElement> build(Token... blocks) {
        return builder.build(new Document(List.of(blocks)), StyleMatch.defaults());
    }

    private static ListItem item(String text) {
        return new ListItem(List.of(new Text(text)));
    }

    private static List<String> describe(List<StyledElement> elements) {
        return elements.stream().map(DocumentBuilderTest::describe).collect(Collectors.toList());
    }

    private static String describe(StyledElement element) {
        if (element instanceof BlockBreak blockBreak) {
            return (blockBreak.edge() == BlockBreak.Edge.BEFORE ? "before:" : "after:") + blockBreak.blockKey();
        }
        if (element instanceof TextRun run) {
            return "text:" + run.text();
        }
        if (element instanceof ListItemStart start) {
            return "item:" + start.depth() + ":" + start.marker();
        }
        if (element instanceof ListItemEnd end) {
            return "end:" + end.depth();
        }
        if (element instanceof RuleElement) {
            return "rule";
        }
        return element.getClass().getSimpleName();
    }
}
