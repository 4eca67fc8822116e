package dev.markdown2pdf.token;

import dev.markdown2pdf.lexer.LexicalUnit;
import dev.markdown2pdf.lexer.UnitKind;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assembles the unit stream produced by the scanner into a {@link Document} tree.
 *
 * <p>Blocks are built line by line. Consecutive plain lines form a paragraph, consecutive {@code >} lines a
 * block quote and consecutive list lines a list, nesting by indentation. A blank line closes every open
 * block; a plain line right after a list item or quote line continues it. Inline content of every block goes
 * through an {@link InlineAssembler}.
 */
public class TokenBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(TokenBuilder.class);

    public Document build(List<LexicalUnit> units) {
        Objects.requireNonNull(units, "units");
        Document document = new Assembly(new UnitCursor(units)).run();
        LOGGER.debug("Built {} top-level blocks from {} units", document.children().size(), units.size());
        return document;
    }

    private static final class Assembly {

        private final UnitCursor cursor;
        private final List<Token> blocks = new ArrayList<>();
        private final Deque<ListFrame> lists = new ArrayDeque<>();
        private InlineAssembler paragraph;
        private QuoteFrame quote;

        private Assembly(UnitCursor cursor) {
            this.cursor = cursor;
        }

        Document run() {
            while (cursor.hasNext()) {
                LexicalUnit unit = cursor.peek();
                switch (unit.kind()) {
                    case NEWLINE -> {
                        cursor.next();
                        closeAll();
                    }
                    case CODE_FENCE -> {
                        closeAll();
                        readCodeBlock(cursor.next());
                    }
                    case RAW_TEXT -> throw new StructuralException(
                            "Verbatim text outside a code fence at offset " + unit.offset());
                    case HEADING_MARKER -> {
                        closeAll();
                        readHeading(cursor.next());
                    }
                    case HORIZONTAL_RULE -> {
                        closeAll();
                        cursor.next();
                        readLine();
                        blocks.add(new HorizontalRule());
                    }
                    case BLOCK_QUOTE_MARKER -> {
                        cursor.next();
                        quoteLine(readLine());
                    }
                    case LIST_MARKER -> listLine(cursor.next(), readLine());
                    default -> plainLine(readLine());
                }
            }
            closeAll();
            return new Document(blocks);
        }

        private List<LexicalUnit> readLine() {
            List<LexicalUnit> line = new ArrayList<>();
            while (cursor.hasNext()) {
                LexicalUnit unit = cursor.next();
                if (unit.is(UnitKind.NEWLINE)) {
                    break;
                }
                line.add(unit);
            }
            return line;
        }

        private void readCodeBlock(LexicalUnit fence) {
            StringBuilder content = new StringBuilder();
            boolean closed = false;
            while (cursor.hasNext() && !closed) {
                LexicalUnit unit = cursor.next();
                if (unit.is(UnitKind.RAW_TEXT)) {
                    content.append(unit.text());
                } else if (unit.is(UnitKind.CODE_FENCE)) {
                    closed = true;
                } else {
                    throw new StructuralException(
                            "Unexpected " + unit.kind() + " unit inside a code fence at offset " + unit.offset());
                }
            }
            if (!closed) {
                LOGGER.warn("Code fence opened at offset {} is never closed; closing it at end of input",
                        fence.offset());
            } else if (cursor.hasNext() && cursor.peek().is(UnitKind.NEWLINE)) {
                cursor.next();
            }
            blocks.add(new CodeBlock(languageOf(fence.text()), content.toString()));
        }

        private void readHeading(LexicalUnit marker) {
            InlineAssembler inline = new InlineAssembler();
            inline.append(readLine());
            blocks.add(new Heading(marker.text().length(), inline.finish()));
        }

        private void plainLine(List<LexicalUnit> units) {
            if (isEmptyLine(units)) {
                return;
            }
            if (!lists.isEmpty()) {
                lists.peek().continueItem(units);
            } else if (quote != null) {
                quote.append(units);
            } else if (paragraph == null) {
                paragraph = new InlineAssembler();
                paragraph.append(units);
            } else {
                paragraph.softBreak();
                paragraph.append(units);
            }
        }

        private void quoteLine(List<LexicalUnit> units) {
            closeParagraph();
            closeLists();
            if (quote == null) {
                quote = new QuoteFrame();
            }
            if (isEmptyLine(units)) {
                quote.closeParagraph();
            } else {
                quote.append(units);
            }
        }

        private void listLine(LexicalUnit marker, List<LexicalUnit> units) {
            closeParagraph();
            closeQuote();
            int indent = marker.indentWidth();
            boolean ordered = isOrdered(marker.text());
            while (!lists.isEmpty() && lists.peek().indent > indent) {
                closeTopList();
            }
            if (!lists.isEmpty() && lists.peek().indent == indent) {
                if (lists.peek().ordered == ordered) {
                    lists.peek().finishItem();
                    lists.peek().continueItem(units);
                    return;
                }
                closeTopList();
            }
            ListFrame frame = new ListFrame(indent, ordered);
            lists.push(frame);
            frame.continueItem(units);
        }

        private void closeAll() {
            closeParagraph();
            closeQuote();
            closeLists();
        }

        private void closeParagraph() {
            if (paragraph != null) {
                blocks.add(new Paragraph(paragraph.finish()));
                paragraph = null;
            }
        }

        private void closeQuote() {
            if (quote != null) {
                blocks.add(quote.toToken());
                quote = null;
            }
        }

        private void closeLists() {
            while (!lists.isEmpty()) {
                closeTopList();
            }
        }

        private void closeTopList() {
            ListBlock list = lists.pop().toToken();
            if (lists.isEmpty()) {
                blocks.add(list);
            } else {
                lists.peek().nest(list);
            }
        }

        private static boolean isEmptyLine(List<LexicalUnit> units) {
            return units.stream().allMatch(unit -> unit.is(UnitKind.COMMENT));
        }

        private static boolean isOrdered(String marker) {
            char last = marker.charAt(marker.length() - 1);
            return last == '.' || last == ')';
        }

        private static Optional<String> languageOf(String fence) {
            String info = fence.replace("`", " ").trim();
            if (info.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(info.split("\\s+", 2)[0]);
        }
    }

    private static final class QuoteFrame {

        private final List<Token> children = new ArrayList<>();
        private InlineAssembler inline;

        void append(List<LexicalUnit> units) {
            if (inline == null) {
                inline = new InlineAssembler();
            } else {
                inline.softBreak();
            }
            inline.append(units);
        }

        void closeParagraph() {
            if (inline != null) {
                children.add(new Paragraph(inline.finish()));
                inline = null;
            }
        }

        BlockQuote toToken() {
            closeParagraph();
            return new BlockQuote(children);
        }
    }

    private static final class ListFrame {

        private final int indent;
        private final boolean ordered;
        private final List<ListItem> items = new ArrayList<>();
        private List<Token> itemChildren = new ArrayList<>();
        private InlineAssembler inline;

        private ListFrame(int indent, boolean ordered) {
            this.indent = indent;
            this.ordered = ordered;
        }

        void continueItem(List<LexicalUnit> units) {
            if (inline == null) {
                inline = new InlineAssembler();
            } else {
                inline.softBreak();
            }
            inline.append(units);
        }

        void nest(ListBlock list) {
            flushInline();
            itemChildren.add(list);
        }

        void finishItem() {
            flushInline();
            items.add(new ListItem(itemChildren));
            itemChildren = new ArrayList<>();
        }

        ListBlock toToken() {
            finishItem();
            return new ListBlock(ordered, items);
        }

        private void flushInline() {
            if (inline != null) {
                itemChildren.addAll(inline.finish());
                inline = null;
            }
        }
    }
}
