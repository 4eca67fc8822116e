package dev.markdown2pdf.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits Markdown text into a flat sequence of {@link LexicalUnit}s.
 *
 * <p>Block constructs are recognized at the start of a line (after at most three spaces of indentation,
 * list markers excepted), inline constructs everywhere else. Inside an open code fence every line is
 * emitted verbatim as {@link UnitKind#RAW_TEXT}, newline included, until a closing fence of equal or greater
 * length. The newline after an opening fence is consumed with the fence.
 *
 * <p>Unknown syntax is never an error: anything that is not a recognized construct ends up in a
 * {@link UnitKind#TEXT} unit. The only failure is text that is not well-formed UTF-16.
 */
public class Scanner {

    private static final Logger LOGGER = LoggerFactory.getLogger(Scanner.class);
    private static final String ESCAPABLE = "!\"#$%&'()*+,-./:;<=>?@[\\]^_`{|}~";
    private static final int MAX_BLOCK_INDENT = 3;
    private static final int MAX_HEADING_LEVEL = 6;
    private static final int MIN_FENCE_LENGTH = 3;
    private static final int MAX_ORDINAL_DIGITS = 9;
    private static final int TAB_WIDTH = 4;

    public List<LexicalUnit> scan(String text) {
        Objects.requireNonNull(text, "text");
        requireWellFormed(text);
        List<LexicalUnit> units = new Pass(text).run();
        LOGGER.debug("Scanned {} characters into {} lexical units", text.length(), units.size());
        return List.copyOf(units);
    }

    private static void requireWellFormed(String text) {
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (Character.isHighSurrogate(ch)) {
                if (i + 1 >= text.length() || !Character.isLowSurrogate(text.charAt(i + 1))) {
                    throw new ScannerException("Unpaired high surrogate", i);
                }
                i++;
            } else if (Character.isLowSurrogate(ch)) {
                throw new ScannerException("Unpaired low surrogate", i);
            }
        }
    }

    private static boolean isBlank(char ch) {
        return ch == ' ' || ch == '\t' || ch == '\r';
    }

    private static final class Pass {

        private final String text;
        private final int length;
        private final List<LexicalUnit> units = new ArrayList<>();
        private int pos;
        private int fenceLength;
        private int parenFound = -1;
        private int commentCloseFound = -1;

        private Pass(String text) {
            this.text = text;
            this.length = text.length();
        }

        List<LexicalUnit> run() {
            while (pos < length) {
                int lineEnd = lineEnd(pos);
                if (fenceLength > 0) {
                    scanFencedLine(lineEnd);
                } else {
                    scanLine(lineEnd);
                }
            }
            return units;
        }

        private void scanFencedLine(int lineEnd) {
            int contentEnd = trimTrailing(pos, lineEnd);
            int indentEnd = skipBlanks(pos, contentEnd);
            if (width(pos, indentEnd) <= MAX_BLOCK_INDENT && closesFence(indentEnd, contentEnd)) {
                units.add(LexicalUnit.of(UnitKind.CODE_FENCE, text.substring(indentEnd, contentEnd), indentEnd));
                fenceLength = 0;
                endLine(lineEnd);
                return;
            }
            int next = lineEnd < length ? lineEnd + 1 : lineEnd;
            units.add(LexicalUnit.of(UnitKind.RAW_TEXT, text.substring(pos, next), pos));
            pos = next;
        }

        private void scanLine(int lineEnd) {
            int contentEnd = trimTrailing(pos, lineEnd);
            int indentEnd = skipBlanks(pos, contentEnd);
            if (indentEnd == contentEnd) {
                endLine(lineEnd);
                return;
            }
            boolean blockIndent = width(pos, indentEnd) <= MAX_BLOCK_INDENT;
            char first = text.charAt(indentEnd);

            if (blockIndent && first == '`' && runEnd(indentEnd, contentEnd, '`') - indentEnd >= MIN_FENCE_LENGTH) {
                fenceLength = runEnd(indentEnd, contentEnd, '`') - indentEnd;
                units.add(LexicalUnit.of(UnitKind.CODE_FENCE, text.substring(indentEnd, contentEnd), indentEnd));
                pos = lineEnd < length ? lineEnd + 1 : lineEnd;
                return;
            }
            if (blockIndent && first == '#') {
                int markerEnd = runEnd(indentEnd, contentEnd, '#');
                if (markerEnd - indentEnd <= MAX_HEADING_LEVEL
                        && (markerEnd == contentEnd || isBlank(text.charAt(markerEnd)))) {
                    units.add(LexicalUnit.of(UnitKind.HEADING_MARKER, text.substring(indentEnd, markerEnd), indentEnd));
                    endLine(scanInline(skipBlanks(markerEnd, contentEnd), lineEnd));
                    return;
                }
            }
            if (blockIndent && isRule(indentEnd, contentEnd)) {
                units.add(LexicalUnit.of(UnitKind.HORIZONTAL_RULE, text.substring(indentEnd, contentEnd), indentEnd));
                endLine(lineEnd);
                return;
            }
            if (blockIndent && first == '>') {
                units.add(LexicalUnit.of(UnitKind.BLOCK_QUOTE_MARKER, ">", indentEnd));
                endLine(scanInline(skipBlanks(indentEnd + 1, contentEnd), lineEnd));
                return;
            }
            int markerEnd = listMarkerEnd(indentEnd, contentEnd);
            if (markerEnd > 0) {
                units.add(LexicalUnit.of(UnitKind.LIST_MARKER, text.substring(pos, markerEnd), pos));
                endLine(scanInline(skipBlanks(markerEnd, contentEnd), lineEnd));
                return;
            }
            endLine(scanInline(indentEnd, lineEnd));
        }

        /**
         * Scans inline constructs from {@code from} to the end of the line and returns the end of the line
         * actually reached, which lies further on when a comment spans several lines.
         */
        private int scanInline(int from, int lineEnd) {
            int to = trimTrailing(from, lineEnd);
            int i = from;
            int textStart = from;
            while (i < to) {
                char ch = text.charAt(i);
                if (ch == '\\' && i + 1 < to && ESCAPABLE.indexOf(text.charAt(i + 1)) >= 0) {
                    flushText(textStart, i);
                    units.add(LexicalUnit.of(UnitKind.TEXT, String.valueOf(text.charAt(i + 1)), i));
                    i += 2;
                    textStart = i;
                } else if (ch == '*' || ch == '_') {
                    int end = runEnd(i, to, ch);
                    Flank flank = flankOf(from, i, end, to, ch);
                    if (flank != Flank.NONE) {
                        flushText(textStart, i);
                        units.add(new LexicalUnit(UnitKind.EMPHASIS_MARKER, text.substring(i, end), i, flank));
                        textStart = end;
                    }
                    i = end;
                } else if (ch == '`') {
                    int end = runEnd(i, to, '`');
                    int close = closingBackticks(end, to, end - i);
                    if (close >= 0) {
                        flushText(textStart, i);
                        int spanEnd = close + (end - i);
                        units.add(LexicalUnit.of(UnitKind.CODE_SPAN, text.substring(i, spanEnd), i));
                        textStart = spanEnd;
                        i = spanEnd;
                    } else {
                        i = end;
                    }
                } else if (ch == '!' && i + 1 < to && text.charAt(i + 1) == '[') {
                    flushText(textStart, i);
                    units.add(LexicalUnit.of(UnitKind.IMAGE_OPEN, "![", i));
                    i += 2;
                    textStart = i;
                } else if (ch == '[') {
                    flushText(textStart, i);
                    units.add(LexicalUnit.of(UnitKind.LINK_OPEN, "[", i));
                    i++;
                    textStart = i;
                } else if (ch == ']') {
                    flushText(textStart, i);
                    units.add(LexicalUnit.of(UnitKind.LINK_CLOSE, "]", i));
                    i++;
                    if (i < to && text.charAt(i) == '(') {
                        int close = closingParen(i);
                        if (close >= 0 && close < to) {
                            units.add(LexicalUnit.of(UnitKind.LINK_TARGET, text.substring(i, close + 1), i));
                            i = close + 1;
                        }
                    }
                    textStart = i;
                } else if (ch == '<' && text.startsWith("<!--", i) && commentClose(i + 4) >= 0) {
                    flushText(textStart, i);
                    int end = commentClose(i + 4) + 3;
                    units.add(LexicalUnit.of(UnitKind.COMMENT, text.substring(i, end), i));
                    if (end > to) {
                        lineEnd = lineEnd(end);
                        to = trimTrailing(end, lineEnd);
                    }
                    i = end;
                    textStart = end;
                } else {
                    i++;
                }
            }
            flushText(textStart, to);
            return lineEnd;
        }

        private Flank flankOf(int lineStart, int start, int end, int to, char marker) {
            char before = start > lineStart ? text.charAt(start - 1) : ' ';
            char after = end < to ? text.charAt(end) : ' ';
            boolean canOpen = !Character.isWhitespace(after);
            boolean canClose = !Character.isWhitespace(before);
            if (marker == '_' && Character.isLetterOrDigit(before) && Character.isLetterOrDigit(after)) {
                return Flank.NONE;
            }
            return Flank.of(canOpen, canClose);
        }

        private int closingBackticks(int from, int to, int length) {
            int i = from;
            while (i < to) {
                if (text.charAt(i) == '`') {
                    int end = runEnd(i, to, '`');
                    if (end - i == length) {
                        return i;
                    }
                    i = end;
                } else {
                    i++;
                }
            }
            return -1;
        }

        private boolean closesFence(int from, int to) {
            int end = runEnd(from, to, '`');
            return end == to && end - from >= fenceLength;
        }

        private boolean isRule(int from, int to) {
            char marker = text.charAt(from);
            if (marker != '-' && marker != '*' && marker != '_') {
                return false;
            }
            int count = 0;
            for (int i = from; i < to; i++) {
                char ch = text.charAt(i);
                if (ch == marker) {
                    count++;
                } else if (!isBlank(ch)) {
                    return false;
                }
            }
            return count >= 3;
        }

        private int listMarkerEnd(int from, int to) {
            char ch = text.charAt(from);
            int end;
            if (ch == '-' || ch == '*' || ch == '+') {
                end = from + 1;
            } else if (Character.isDigit(ch)) {
                int digitsEnd = from;
                while (digitsEnd < to && Character.isDigit(text.charAt(digitsEnd)) && digitsEnd - from < MAX_ORDINAL_DIGITS) {
                    digitsEnd++;
                }
                if (digitsEnd >= to || (text.charAt(digitsEnd) != '.' && text.charAt(digitsEnd) != ')')) {
                    return -1;
                }
                end = digitsEnd + 1;
            } else {
                return -1;
            }
            return end < to && isBlank(text.charAt(end)) ? end : -1;
        }

        private void flushText(int start, int end) {
            if (end > start) {
                units.add(LexicalUnit.of(UnitKind.TEXT, text.substring(start, end), start));
            }
        }

        private void endLine(int lineEnd) {
            if (lineEnd < length) {
                units.add(LexicalUnit.of(UnitKind.NEWLINE, "\n", lineEnd));
                pos = lineEnd + 1;
            } else {
                pos = length;
            }
        }

        private int lineEnd(int from) {
            int newline = text.indexOf('\n', from);
            return newline < 0 ? length : newline;
        }

        private int trimTrailing(int from, int lineEnd) {
            int end = lineEnd;
            while (end > from && isBlank(text.charAt(end - 1))) {
                end--;
            }
            return end;
        }

        private int skipBlanks(int from, int to) {
            int i = from;
            while (i < to && isBlank(text.charAt(i))) {
                i++;
            }
            return i;
        }

        /**
         * First {@code ')'} at or after {@code from}, or -1. Searches only move forward, so an earlier hit
         * that still lies ahead is reused.
         */
        private int closingParen(int from) {
            if (parenFound < from) {
                int found = text.indexOf(')', from);
                parenFound = found < 0 ? length : found;
            }
            return parenFound == length ? -1 : parenFound;
        }

        private int commentClose(int from) {
            if (commentCloseFound < from) {
                int found = text.indexOf("-->", from);
                commentCloseFound = found < 0 ? length : found;
            }
            return commentCloseFound == length ? -1 : commentCloseFound;
        }

        private int runEnd(int from, int to, char ch) {
            int i = from;
            while (i < to && text.charAt(i) == ch) {
                i++;
            }
            return i;
        }

        private int width(int from, int to) {
            int width = 0;
            for (int i = from; i < to; i++) {
                width += text.charAt(i) == '\t' ? TAB_WIDTH - (width % TAB_WIDTH) : 1;
            }
            return width;
        }
    }
}
