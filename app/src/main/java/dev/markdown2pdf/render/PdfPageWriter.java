package dev.markdown2pdf.render;

import dev.markdown2pdf.document.BlockBreak;
import dev.markdown2pdf.document.CodeBlockElement;
import dev.markdown2pdf.document.ImageRun;
import dev.markdown2pdf.document.LinkRun;
import dev.markdown2pdf.document.ListItemEnd;
import dev.markdown2pdf.document.ListItemStart;
import dev.markdown2pdf.document.RuleElement;
import dev.markdown2pdf.document.StyledElement;
import dev.markdown2pdf.document.TextRun;
import dev.markdown2pdf.style.Color;
import dev.markdown2pdf.style.Margins;
import dev.markdown2pdf.style.ResolvedStyle;
import dev.markdown2pdf.style.TextAlignment;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.interactive.action.PDActionURI;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotation;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotationLink;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDBorderStyleDictionary;

/**
 * Lays styled elements out on A4 pages, top to bottom, wrapping text at word boundaries.
 */
final class PdfPageWriter {

    static final float POINTS_PER_MM = 72f / 25.4f;
    static final float LINE_FACTOR = 1.2f;
    static final float LIST_INDENT = 18f;
    static final float QUOTE_INDENT = 14f;
    static final float CODE_PADDING = 4f;
    static final float MIN_TEXT_WIDTH = 36f;
    private static final String QUOTE_KEY = "block-quote";

    private final PDDocument document;
    private final PdfFonts fonts;
    private final float top;
    private final float right;
    private final float bottom;
    private final float left;
    private final Deque<TextAlignment> alignments = new ArrayDeque<>();
    private final List<Fragment> line = new ArrayList<>();
    private PDPage page;
    private PDPageContentStream content;
    private float cursorY;
    private float lineWidth;
    private float listIndent;
    private float quoteIndent;
    private Marker marker;
    private int pages;

    PdfPageWriter(PDDocument document, PdfFonts fonts, Margins margins) {
        this.document = document;
        this.fonts = fonts;
        this.top = (float) margins.top() * POINTS_PER_MM;
        this.right = (float) margins.right() * POINTS_PER_MM;
        this.bottom = (float) margins.bottom() * POINTS_PER_MM;
        this.left = (float) margins.left() * POINTS_PER_MM;
    }

    void write(StyledElement element) throws IOException {
        if (element instanceof TextRun run) {
            addText(run.text(), run.style(), null);
        } else if (element instanceof LinkRun link) {
            for (TextRun span : link.spans()) {
                addText(span.text(), span.style(), link.url());
            }
        } else if (element instanceof ImageRun image) {
            addText(image.alt().isBlank() ? image.url() : image.alt(), image.style(), null);
        } else if (element instanceof BlockBreak blockBreak) {
            blockBreak(blockBreak);
        } else if (element instanceof CodeBlockElement code) {
            codeBlock(code);
        } else if (element instanceof ListItemStart start) {
            flushLine(false);
            listIndent = start.depth() * LIST_INDENT;
            marker = new Marker(fonts.sanitize(start.style(), start.marker()), start.style());
        } else if (element instanceof ListItemEnd end) {
            flushLine(false);
            listIndent = (end.depth() - 1) * LIST_INDENT;
        } else if (element instanceof RuleElement rule) {
            rule(rule.style());
        }
    }

    /**
     * Flushes pending text and closes the last page. Returns the number of pages written.
     */
    int finish() throws IOException {
        flushLine(false);
        if (page == null) {
            newPage();
        }
        content.close();
        content = null;
        return pages;
    }

    private void blockBreak(BlockBreak blockBreak) throws IOException {
        flushLine(false);
        ResolvedStyle style = blockBreak.style();
        if (blockBreak.edge() == BlockBreak.Edge.BEFORE) {
            alignments.push(style.alignment());
            if (QUOTE_KEY.equals(blockBreak.blockKey())) {
                quoteIndent += QUOTE_INDENT;
            }
            return;
        }
        alignments.poll();
        if (QUOTE_KEY.equals(blockBreak.blockKey())) {
            quoteIndent -= QUOTE_INDENT;
        }
        cursorY -= (float) (style.afterSpacing() * style.size()) * LINE_FACTOR;
    }

    private void addText(String text, ResolvedStyle style, String url) throws IOException {
        PDFont font = fonts.font(style);
        float size = (float) style.size();
        String clean = fonts.sanitize(style, text);
        int i = 0;
        while (i < clean.length()) {
            int end = i;
            while (end < clean.length() && clean.charAt(end) != ' ') {
                end++;
            }
            while (end < clean.length() && clean.charAt(end) == ' ') {
                end++;
            }
            String piece = clean.substring(i, end);
            i = end;
            if (line.isEmpty() && piece.isBlank()) {
                continue;
            }
            float fitWidth = fonts.width(font, piece.stripTrailing(), size);
            if (!line.isEmpty() && lineWidth + fitWidth > availableWidth()) {
                flushLine(true);
                if (piece.isBlank()) {
                    continue;
                }
            }
            if (fitWidth > availableWidth()) {
                addLongPiece(piece, font, size, style, url);
            } else {
                append(new Fragment(piece, font, size, style, url, fonts.width(font, piece, size)));
            }
        }
    }

    private void addLongPiece(String piece, PDFont font, float size, ResolvedStyle style, String url)
            throws IOException {
        int start = 0;
        while (start < piece.length()) {
            int end = start + 1;
            while (end < piece.length() && fonts.width(font, piece.substring(start, end + 1), size) <= availableWidth()) {
                end++;
            }
            String chunk = piece.substring(start, end);
            append(new Fragment(chunk, font, size, style, url, fonts.width(font, chunk, size)));
            start = end;
            if (start < piece.length()) {
                flushLine(true);
            }
        }
    }

    private void append(Fragment fragment) {
        line.add(fragment);
        lineWidth += fragment.width();
    }

    private void flushLine(boolean wrapped) throws IOException {
        if (line.isEmpty() && marker == null) {
            return;
        }
        if (!line.isEmpty()) {
            Fragment last = line.get(line.size() - 1);
            String trimmed = last.text().stripTrailing();
            line.set(line.size() - 1, new Fragment(trimmed, last.font(), last.size(), last.style(), last.url(),
                    fonts.width(last.font(), trimmed, last.size())));
        }
        float maxSize = marker == null ? 0 : (float) marker.style().size();
        float contentWidth = 0;
        int gaps = 0;
        for (int i = 0; i < line.size(); i++) {
            Fragment fragment = line.get(i);
            maxSize = Math.max(maxSize, fragment.size());
            contentWidth += fragment.width();
            if (i < line.size() - 1 && fragment.text().endsWith(" ")) {
                gaps++;
            }
        }
        float lineHeight = maxSize * LINE_FACTOR;
        ensureSpace(lineHeight);
        float baseline = cursorY - maxSize;
        float textLeft = left + quoteIndent + listIndent;
        float available = availableWidth();
        float x = textLeft;
        float gap = 0;
        switch (alignment()) {
            case CENTER -> x += Math.max(0, (available - contentWidth) / 2);
            case RIGHT -> x += Math.max(0, available - contentWidth);
            case JUSTIFY -> gap = wrapped && gaps > 0 ? Math.max(0, (available - contentWidth) / gaps) : 0;
            case LEFT -> {
            }
        }
        if (marker != null) {
            PDFont markerFont = fonts.font(marker.style());
            float markerSize = (float) marker.style().size();
            float markerWidth = fonts.width(markerFont, marker.text(), markerSize);
            float markerX = Math.max(left, textLeft - CODE_PADDING - markerWidth);
            drawText(marker.text(), markerFont, markerSize, marker.style().textColor(), markerX, baseline);
            marker = null;
        }
        for (Fragment fragment : line) {
            drawFragment(fragment, x, baseline);
            x += fragment.width();
            if (fragment.text().endsWith(" ")) {
                x += gap;
            }
        }
        line.clear();
        lineWidth = 0;
        cursorY -= lineHeight;
    }

    private void drawFragment(Fragment fragment, float x, float baseline) throws IOException {
        ResolvedStyle style = fragment.style();
        float size = fragment.size();
        if (style.backgroundColor().isPresent()) {
            fill(style.backgroundColor().get(), x, baseline - size * 0.25f, fragment.width(), size * 1.2f);
        }
        drawText(fragment.text(), fragment.font(), size, style.textColor(), x, baseline);
        if (style.underline()) {
            stroke(style.textColor(), size * 0.06f, x, baseline - size * 0.12f, x + fragment.width());
        }
        if (style.strikethrough()) {
            stroke(style.textColor(), size * 0.06f, x, baseline + size * 0.3f, x + fragment.width());
        }
        if (fragment.url() != null) {
            annotateLink(fragment.url(), x, baseline - size * 0.25f, fragment.width(), size * 1.2f);
        }
    }

    private void codeBlock(CodeBlockElement code) throws IOException {
        flushLine(false);
        ResolvedStyle style = code.style();
        PDFont font = fonts.font(style);
        float size = (float) style.size();
        float lineHeight = size * LINE_FACTOR;
        float x = left + quoteIndent + listIndent;
        float width = availableWidth();
        List<String> lines = codeLines(code.content(), style, font, size, width - 2 * CODE_PADDING);
        ensureSpace(lineHeight + CODE_PADDING);
        Color band = style.backgroundColor().orElse(null);
        if (band != null) {
            fill(band, x, cursorY - CODE_PADDING, width, CODE_PADDING);
        }
        cursorY -= CODE_PADDING;
        for (String codeLine : lines) {
            ensureSpace(lineHeight);
            if (band != null) {
                fill(band, x, cursorY - lineHeight, width, lineHeight);
            }
            drawText(codeLine, font, size, style.textColor(), x + CODE_PADDING, cursorY - size);
            cursorY -= lineHeight;
        }
        if (band != null) {
            fill(band, x, cursorY - CODE_PADDING, width, CODE_PADDING);
        }
        cursorY -= CODE_PADDING;
    }

    private List<String> codeLines(String content, ResolvedStyle style, PDFont font, float size, float width)
            throws IOException {
        String body = content.endsWith("\n") ? content.substring(0, content.length() - 1) : content;
        List<String> lines = new ArrayList<>();
        for (String raw : body.split("\n", -1)) {
            String text = fonts.sanitize(style, raw.replace("\t", "    ").stripTrailing());
            while (text.length() > 1 && fonts.width(font, text, size) > width) {
                int end = text.length() - 1;
                while (end > 1 && fonts.width(font, text.substring(0, end), size) > width) {
                    end--;
                }
                lines.add(text.substring(0, end));
                text = text.substring(end);
            }
            lines.add(text);
        }
        return lines;
    }

    private void rule(ResolvedStyle style) throws IOException {
        flushLine(false);
        float size = (float) style.size();
        ensureSpace(size);
        float x = left + quoteIndent + listIndent;
        stroke(style.textColor(), 1f, x, cursorY - size / 2, x + availableWidth());
        cursorY -= size;
    }

    private void drawText(String text, PDFont font, float size, Color color, float x, float y) throws IOException {
        if (text.isEmpty()) {
            return;
        }
        content.beginText();
        content.setFont(font, size);
        content.setNonStrokingColor(channel(color.red()), channel(color.green()), channel(color.blue()));
        content.newLineAtOffset(x, y);
        content.showText(text);
        content.endText();
    }

    private void fill(Color color, float x, float y, float width, float height) throws IOException {
        content.setNonStrokingColor(channel(color.red()), channel(color.green()), channel(color.blue()));
        content.addRect(x, y, width, height);
        content.fill();
    }

    private void stroke(Color color, float thickness, float fromX, float y, float toX) throws IOException {
        content.setStrokingColor(channel(color.red()), channel(color.green()), channel(color.blue()));
        content.setLineWidth(thickness);
        content.moveTo(fromX, y);
        content.lineTo(toX, y);
        content.stroke();
    }

    private void annotateLink(String url, float x, float y, float width, float height) throws IOException {
        PDActionURI action = new PDActionURI();
        action.setURI(url);
        PDBorderStyleDictionary border = new PDBorderStyleDictionary();
        border.setWidth(0);
        PDAnnotationLink link = new PDAnnotationLink();
        link.setRectangle(new PDRectangle(x, y, width, height));
        link.setBorderStyle(border);
        link.setAction(action);
        List<PDAnnotation> annotations = page.getAnnotations();
        annotations.add(link);
        page.setAnnotations(annotations);
    }

    private void ensureSpace(float height) throws IOException {
        if (page == null) {
            newPage();
            return;
        }
        boolean pageHasContent = cursorY < page.getMediaBox().getHeight() - top;
        if (pageHasContent && cursorY - height < bottom) {
            newPage();
        }
    }

    private void newPage() throws IOException {
        if (content != null) {
            content.close();
        }
        page = new PDPage(PDRectangle.A4);
        document.addPage(page);
        content = new PDPageContentStream(document, page);
        cursorY = page.getMediaBox().getHeight() - top;
        pages++;
    }

    private float availableWidth() {
        return Math.max(MIN_TEXT_WIDTH, PDRectangle.A4.getWidth() - left - right - quoteIndent - listIndent);
    }

    private TextAlignment alignment() {
        TextAlignment alignment = alignments.peek();
        return alignment == null ? TextAlignment.LEFT : alignment;
    }

    private static float channel(int value) {
        return value / 255f;
    }

    private record Fragment(String text, PDFont font, float size, ResolvedStyle style, String url, float width) {
    }

    private record Marker(String text, ResolvedStyle style) {
    }
}
