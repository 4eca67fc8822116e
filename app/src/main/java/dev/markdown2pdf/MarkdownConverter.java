package dev.markdown2pdf;

import dev.markdown2pdf.document.DocumentBuilder;
import dev.markdown2pdf.document.StyledDocument;
import dev.markdown2pdf.document.StyledElement;
import dev.markdown2pdf.lexer.LexicalUnit;
import dev.markdown2pdf.lexer.Scanner;
import dev.markdown2pdf.style.StyleMatch;
import dev.markdown2pdf.token.Document;
import dev.markdown2pdf.token.TokenBuilder;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the scanner, the token builder and the document builder over one Markdown string.
 */
public class MarkdownConverter {

    private static final Logger LOGGER = LoggerFactory.getLogger(MarkdownConverter.class);

    private final Scanner scanner;
    private final TokenBuilder tokenBuilder;
    private final DocumentBuilder documentBuilder;

    public MarkdownConverter() {
        this(new Scanner(), new TokenBuilder(), new DocumentBuilder());
    }

    public MarkdownConverter(Scanner scanner, TokenBuilder tokenBuilder, DocumentBuilder documentBuilder) {
        this.scanner = Objects.requireNonNull(scanner, "scanner");
        this.tokenBuilder = Objects.requireNonNull(tokenBuilder, "tokenBuilder");
        this.documentBuilder = Objects.requireNonNull(documentBuilder, "documentBuilder");
    }

    public Document parse(String markdown) {
        List<LexicalUnit> units = scanner.scan(markdown);
        return tokenBuilder.build(units);
    }

    public StyledDocument convert(String markdown, StyleMatch table) {
        Objects.requireNonNull(table, "table");
        Document document = parse(markdown);
        List<StyledElement> elements = documentBuilder.build(document, table);
        LOGGER.debug("Converted {} blocks into {} styled elements", document.children().size(), elements.size());
        return new StyledDocument(elements, table.margins());
    }
}
