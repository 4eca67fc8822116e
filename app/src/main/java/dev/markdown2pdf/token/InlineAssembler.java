package dev.markdown2pdf.token;

import dev.markdown2pdf.lexer.LexicalUnit;
import dev.markdown2pdf.lexer.UnitKind;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the inline units of one block into tokens.
 *
 * <p>Open emphasis runs and brackets live on a frame stack. An emphasis closer of length n matches the
 * nearest open run of the same character whose length is at most n, never reaching past a bracket; frames
 * above the match are degraded to literal text. A bracket closes into a link or image only when a non-blank
 * target follows, otherwise the whole bracket sequence becomes one {@link Literal} of its source text.
 * Whatever is still open when the block ends is degraded.
 */
final class InlineAssembler {

    private final InlineNode root = InlineNode.container();
    private final List<Frame> frames = new ArrayList<>();
    private final List<Integer> brackets = new ArrayList<>();
    private final Map<Long, SearchFloor> searchFloors = new HashMap<>();
    private final StringBuilder source = new StringBuilder();
    private int lowestDepth = Integer.MAX_VALUE;

    void append(List<LexicalUnit> units) {
        for (int i = 0; i < units.size(); i++) {
            LexicalUnit unit = units.get(i);
            switch (unit.kind()) {
                case TEXT -> {
                    source.append(unit.text());
                    add(InlineNode.text(unit.text()));
                }
                case CODE_SPAN -> {
                    source.append(unit.text());
                    add(InlineNode.codeSpan(codeSpanContent(unit.text())));
                }
                case EMPHASIS_MARKER -> {
                    source.append(unit.text());
                    emphasis(unit);
                }
                case LINK_OPEN, IMAGE_OPEN -> {
                    push(Frame.bracket(unit, source.length()));
                    source.append(unit.text());
                }
                case LINK_CLOSE -> {
                    source.append(unit.text());
                    LexicalUnit target = null;
                    if (i + 1 < units.size() && units.get(i + 1).is(UnitKind.LINK_TARGET)) {
                        target = units.get(++i);
                        source.append(target.text());
                    }
                    closeBracket(target);
                }
                case LINK_TARGET -> {
                    source.append(unit.text());
                    add(InlineNode.literal(unit.text()));
                }
                case COMMENT -> {
                    // dropped
                }
                default -> throw new StructuralException(
                        "Unexpected " + unit.kind() + " unit in inline content at offset " + unit.offset());
            }
        }
    }

    void softBreak() {
        source.append(' ');
        add(InlineNode.text(" "));
    }

    List<Token> finish() {
        searchFloors.clear();
        if (!brackets.isEmpty()) {
            // the outermost open bracket's source covers every frame above it
            Frame bracket = frames.get(brackets.get(0));
            popTo(brackets.get(0));
            add(InlineNode.source(bracket.sourceStart, source.length()));
        }
        while (!frames.isEmpty()) {
            degrade(pop());
        }
        List<Token> tokens = freeze(root);
        root.children.clear();
        source.setLength(0);
        lowestDepth = Integer.MAX_VALUE;
        return tokens;
    }

    private void emphasis(LexicalUnit unit) {
        char marker = unit.text().charAt(0);
        int remaining = unit.text().length();
        if (unit.flank().canClose()) {
            while (remaining > 0) {
                int match = findEmphasis(marker, remaining);
                if (match < 0) {
                    break;
                }
                while (frames.size() > match + 1) {
                    degrade(pop());
                }
                Frame opener = pop();
                add(opener.node);
                remaining -= opener.node.runLength;
            }
        }
        if (remaining > 0) {
            String rest = String.valueOf(marker).repeat(remaining);
            if (unit.flank().canOpen()) {
                push(Frame.emphasis(marker, rest));
            } else {
                add(InlineNode.literal(rest));
            }
        }
    }

    /**
     * Index of the nearest open run of {@code marker} no longer than {@code maxLength} above the nearest
     * bracket, or -1. Stack ranges already searched in vain for the same marker and length are skipped.
     */
    private int findEmphasis(char marker, int maxLength) {
        trimSearchFloors();
        int bottom = brackets.isEmpty() ? 0 : brackets.get(brackets.size() - 1) + 1;
        long key = ((long) marker << 32) | maxLength;
        SearchFloor searched = searchFloors.get(key);
        int index = frames.size() - 1;
        while (index >= bottom) {
            if (searched != null && index >= searched.bottom && index < searched.top) {
                index = searched.bottom - 1;
                continue;
            }
            Frame frame = frames.get(index);
            if (frame.marker == marker && frame.node.runLength <= maxLength) {
                return index;
            }
            index--;
        }
        searchFloors.put(key, new SearchFloor(bottom, frames.size()));
        return -1;
    }

    private void trimSearchFloors() {
        if (lowestDepth == Integer.MAX_VALUE) {
            return;
        }
        int depth = lowestDepth;
        searchFloors.values().removeIf(floor -> floor.bottom > depth);
        for (SearchFloor floor : searchFloors.values()) {
            floor.top = Math.min(floor.top, depth);
        }
        lowestDepth = Integer.MAX_VALUE;
    }

    private void closeBracket(LexicalUnit target) {
        if (brackets.isEmpty()) {
            add(InlineNode.literal(target == null ? "]" : "]" + target.text()));
            return;
        }
        int index = brackets.get(brackets.size() - 1);
        Frame bracket = frames.get(index);
        String url = target == null ? "" : targetUrl(target.text());
        if (url.isBlank()) {
            popTo(index);
            add(InlineNode.source(bracket.sourceStart, source.length()));
            return;
        }
        while (frames.size() > index + 1) {
            degrade(pop());
        }
        pop();
        InlineNode node = bracket.opener.equals("![") ? InlineNode.image(url) : InlineNode.link(url);
        node.children.addAll(bracket.node.children);
        add(node);
    }

    private void degrade(Frame frame) {
        add(InlineNode.literal(frame.opener));
        frame.node.dissolve();
        add(frame.node);
    }

    private void push(Frame frame) {
        if (frame.isBracket()) {
            brackets.add(frames.size());
        }
        frames.add(frame);
    }

    private Frame pop() {
        Frame frame = frames.remove(frames.size() - 1);
        if (frame.isBracket()) {
            brackets.remove(brackets.size() - 1);
        }
        lowestDepth = Math.min(lowestDepth, frames.size());
        return frame;
    }

    /**
     * Discards every frame from {@code depth} up.
     */
    private void popTo(int depth) {
        while (!brackets.isEmpty() && brackets.get(brackets.size() - 1) >= depth) {
            brackets.remove(brackets.size() - 1);
        }
        frames.subList(depth, frames.size()).clear();
        lowestDepth = Math.min(lowestDepth, depth);
    }

    private void add(InlineNode node) {
        container().children.add(node);
    }

    private InlineNode container() {
        return frames.isEmpty() ? root : frames.get(frames.size() - 1).node;
    }

    private static String targetUrl(String target) {
        String url = target;
        if (url.startsWith("(")) {
            url = url.substring(1);
        }
        if (url.endsWith(")")) {
            url = url.substring(0, url.length() - 1);
        }
        return url.trim();
    }

    private static String codeSpanContent(String span) {
        int fence = 0;
        while (fence < span.length() && span.charAt(fence) == '`') {
            fence++;
        }
        String content = span.substring(fence, Math.max(fence, span.length() - fence));
        if (content.length() > 2 && content.startsWith(" ") && content.endsWith(" ") && !content.isBlank()) {
            return content.substring(1, content.length() - 1);
        }
        return content;
    }

    /**
     * Converts the mutable tree into tokens without recursion, accumulating emphasis levels on the way down.
     * A group writes straight into its parent's token list.
     */
    private List<Token> freeze(InlineNode root) {
        Deque<Pending> stack = new ArrayDeque<>();
        stack.push(new Pending(root, 0, new ArrayList<>()));
        List<Token> result = List.of();
        while (!stack.isEmpty()) {
            Pending top = stack.peek();
            if (top.next < top.node.children.size()) {
                InlineNode child = top.node.children.get(top.next++);
                if (child.isLeaf()) {
                    top.built.add(leaf(child));
                } else if (child.kind == InlineNode.Kind.GROUP) {
                    stack.push(new Pending(child, top.level, top.built));
                } else {
                    stack.push(new Pending(child, top.level + child.runLength, new ArrayList<>()));
                }
                continue;
            }
            stack.pop();
            if (stack.isEmpty()) {
                result = mergeText(top.built);
            } else if (top.node.kind != InlineNode.Kind.GROUP) {
                stack.peek().built.add(top.toToken());
            }
        }
        return result;
    }

    private Token leaf(InlineNode node) {
        return switch (node.kind) {
            case TEXT -> new Text(node.value);
            case LITERAL -> new Literal(node.value);
            case SOURCE -> new Literal(source.substring(node.sourceStart, node.sourceEnd));
            case CODE_SPAN -> new CodeSpan(node.value);
            default -> throw new StructuralException("Inline node " + node.kind + " is not a leaf");
        };
    }

    /**
     * Joins each run of adjacent {@link Text} tokens into one.
     */
    private static List<Token> mergeText(List<Token> tokens) {
        List<Token> merged = new ArrayList<>(tokens.size());
        StringBuilder run = null;
        for (Token token : tokens) {
            if (token instanceof Text text) {
                if (run == null) {
                    run = new StringBuilder();
                }
                run.append(text.content());
                continue;
            }
            if (run != null) {
                merged.add(new Text(run.toString()));
                run = null;
            }
            merged.add(token);
        }
        if (run != null) {
            merged.add(new Text(run.toString()));
        }
        return merged;
    }

    private static final class Pending {

        private final InlineNode node;
        private final int level;
        private final List<Token> built;
        private int next;

        private Pending(InlineNode node, int level, List<Token> built) {
            this.node = node;
            this.level = level;
            this.built = built;
        }

        private Token toToken() {
            return switch (node.kind) {
                case EMPHASIS -> new Emphasis(level, mergeText(built));
                case LINK -> new Link(mergeText(built), node.value);
                case IMAGE -> new Image(Tokens.plainText(built), node.value);
                default -> throw new StructuralException("Inline node " + node.kind + " cannot hold children");
            };
        }
    }

    private static final class SearchFloor {

        private final int bottom;
        private int top;

        private SearchFloor(int bottom, int top) {
            this.bottom = bottom;
            this.top = top;
        }
    }

    private static final class Frame {

        private final String opener;
        private final char marker;
        private final InlineNode node;
        private final int sourceStart;

        private Frame(String opener, char marker, InlineNode node, int sourceStart) {
            this.opener = opener;
            this.marker = marker;
            this.node = node;
            this.sourceStart = sourceStart;
        }

        static Frame emphasis(char marker, String opener) {
            return new Frame(opener, marker, InlineNode.emphasis(opener.length()), -1);
        }

        static Frame bracket(LexicalUnit opener, int sourceStart) {
            return new Frame(opener.text(), '\0', InlineNode.container(), sourceStart);
        }

        boolean isBracket() {
            return sourceStart >= 0;
        }
    }
}
