package dev.markdown2pdf.token;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable inline tree used while emphasis and brackets are still being matched.
 */
final class InlineNode {

    enum Kind {
        CONTAINER,
        GROUP,
        EMPHASIS,
        LINK,
        IMAGE,
        TEXT,
        LITERAL,
        SOURCE,
        CODE_SPAN
    }

    Kind kind;
    final String value;
    int runLength;
    final int sourceStart;
    final int sourceEnd;
    final List<InlineNode> children = new ArrayList<>();

    private InlineNode(Kind kind, String value, int runLength) {
        this(kind, value, runLength, 0, 0);
    }

    private InlineNode(Kind kind, String value, int runLength, int sourceStart, int sourceEnd) {
        this.kind = kind;
        this.value = value;
        this.runLength = runLength;
        this.sourceStart = sourceStart;
        this.sourceEnd = sourceEnd;
    }

    static InlineNode container() {
        return new InlineNode(Kind.CONTAINER, "", 0);
    }

    static InlineNode emphasis(int runLength) {
        return new InlineNode(Kind.EMPHASIS, "", runLength);
    }

    static InlineNode link(String url) {
        return new InlineNode(Kind.LINK, url, 0);
    }

    static InlineNode image(String url) {
        return new InlineNode(Kind.IMAGE, url, 0);
    }

    static InlineNode text(String content) {
        return new InlineNode(Kind.TEXT, content, 0);
    }

    static InlineNode literal(String content) {
        return new InlineNode(Kind.LITERAL, content, 0);
    }

    /**
     * A literal whose text is the block source between two offsets, read only if it survives into the tokens.
     */
    static InlineNode source(int start, int end) {
        return new InlineNode(Kind.SOURCE, "", 0, start, end);
    }

    static InlineNode codeSpan(String content) {
        return new InlineNode(Kind.CODE_SPAN, content, 0);
    }

    /**
     * Turns this node into a group whose children are spliced into the parent when frozen.
     */
    void dissolve() {
        kind = Kind.GROUP;
        runLength = 0;
    }

    boolean isLeaf() {
        return kind == Kind.TEXT || kind == Kind.LITERAL || kind == Kind.SOURCE || kind == Kind.CODE_SPAN;
    }
}
