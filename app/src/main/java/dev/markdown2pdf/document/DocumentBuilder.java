package dev.markdown2pdf.document;

import dev.markdown2pdf.style.DefaultStyles;
import dev.markdown2pdf.style.ResolvedStyle;
import dev.markdown2pdf.style.Style;
import dev.markdown2pdf.style.StyleMatch;
import dev.markdown2pdf.style.StyleResolver;
import dev.markdown2pdf.token.CodeBlock;
import dev.markdown2pdf.token.CodeSpan;
import dev.markdown2pdf.token.HorizontalRule;
import dev.markdown2pdf.token.Image;
import dev.markdown2pdf.token.Link;
import dev.markdown2pdf.token.ListBlock;
import dev.markdown2pdf.token.ListItem;
import dev.markdown2pdf.token.Literal;
import dev.markdown2pdf.token.Text;
import dev.markdown2pdf.token.Token;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Walks a token tree in document order and emits the flat sequence of styled elements.
 *
 * <p>Block tokens are framed by {@link BlockBreak}s, list items by {@link ListItemStart} and
 * {@link ListItemEnd}, and every link becomes a single {@link LinkRun}. The walk uses an explicit work stack
 * that carries each node's ancestry and the style accumulated from its ancestors.
 */
public class DocumentBuilder {

    static final String BULLET = "•";

    private final StyleResolver resolver;

    public DocumentBuilder() {
        this(new StyleResolver());
    }

    public DocumentBuilder(StyleResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    public List<StyledElement> build(Token root, StyleMatch table) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(table, "table");
        List<StyledElement> elements = new ArrayList<>();
        Deque<Work> work = new ArrayDeque<>();
        work.push(Work.visit(root, List.of(), DefaultStyles.BASE, 0));
        while (!work.isEmpty()) {
            Work next = work.pop();
            if (next.element != null) {
                elements.add(next.element);
            } else {
                visit(next, table, elements, work);
            }
        }
        return elements;
    }

    private void visit(Work visit, StyleMatch table, List<StyledElement> elements, Deque<Work> work) {
        Token token = visit.token;
        if (token instanceof Text text) {
            elements.add(new TextRun(text.content(), styleOf(visit, table)));
        } else if (token instanceof Literal literal) {
            elements.add(new TextRun(literal.content(), styleOf(visit, table)));
        } else if (token instanceof CodeSpan codeSpan) {
            elements.add(new TextRun(codeSpan.content(), styleOf(visit, table)));
        } else if (token instanceof Image image) {
            elements.add(new ImageRun(image.alt(), image.url(), styleOf(visit, table)));
        } else if (token instanceof Link link) {
            elements.add(linkRun(link, visit, table));
        } else if (token instanceof CodeBlock codeBlock) {
            ResolvedStyle style = styleOf(visit, table);
            elements.add(new BlockBreak(token.kindKey(), BlockBreak.Edge.BEFORE, style));
            elements.add(new CodeBlockElement(codeBlock.language(), codeBlock.content(), style));
            elements.add(new BlockBreak(token.kindKey(), BlockBreak.Edge.AFTER, style));
        } else if (token instanceof HorizontalRule) {
            ResolvedStyle style = styleOf(visit, table);
            elements.add(new BlockBreak(token.kindKey(), BlockBreak.Edge.BEFORE, style));
            elements.add(new RuleElement(style));
            elements.add(new BlockBreak(token.kindKey(), BlockBreak.Edge.AFTER, style));
        } else if (token instanceof ListBlock list) {
            visitList(list, visit, table, elements, work);
        } else {
            if (token.kind().isBlock()) {
                ResolvedStyle style = styleOf(visit, table);
                elements.add(new BlockBreak(token.kindKey(), BlockBreak.Edge.BEFORE, style));
                work.push(Work.emit(new BlockBreak(token.kindKey(), BlockBreak.Edge.AFTER, style)));
            }
            pushChildren(token, visit, table, visit.listDepth, work);
        }
    }

    private void visitList(ListBlock list, Work visit, StyleMatch table, List<StyledElement> elements,
            Deque<Work> work) {
        ResolvedStyle style = styleOf(visit, table);
        int depth = visit.listDepth + 1;
        List<String> listAncestry = extend(visit.ancestry, list.kindKey());
        Style listContext = resolver.descend(visit.context, visit.ancestry, list.kindKey(), table);
        elements.add(new BlockBreak(list.kindKey(), BlockBreak.Edge.BEFORE, style));
        work.push(Work.emit(new BlockBreak(list.kindKey(), BlockBreak.Edge.AFTER, style)));
        List<ListItem> items = list.items();
        for (int i = items.size() - 1; i >= 0; i--) {
            ListItem item = items.get(i);
            Work itemVisit = Work.visit(item, listAncestry, listContext, depth);
            String marker = list.ordered() ? (i + 1) + "." : BULLET;
            work.push(Work.emit(new ListItemEnd(depth)));
            pushChildren(item, itemVisit, table, depth, work);
            work.push(Work.emit(new ListItemStart(depth, marker, styleOf(itemVisit, table))));
        }
    }

    private LinkRun linkRun(Link link, Work visit, StyleMatch table) {
        Style override = link.styleOverride().orElse(null);
        List<TextRun> spans = new ArrayList<>();
        Deque<Work> pending = new ArrayDeque<>();
        pushChildren(link, visit, table, 0, pending);
        while (!pending.isEmpty()) {
            Work next = pending.pop();
            Token token = next.token;
            String text = null;
            if (token instanceof Text value) {
                text = value.content();
            } else if (token instanceof Literal value) {
                text = value.content();
            } else if (token instanceof CodeSpan value) {
                text = value.content();
            } else if (token instanceof Image value) {
                text = value.alt();
            } else {
                pushChildren(token, next, table, 0, pending);
            }
            if (text != null && !text.isEmpty()) {
                spans.add(new TextRun(text, styleOf(next, table).withOverride(override)));
            }
        }
        if (spans.isEmpty()) {
            spans.add(new TextRun(link.url(), styleOf(visit, table).withOverride(override)));
        }
        return new LinkRun(link.url(), spans);
    }

    private ResolvedStyle styleOf(Work visit, StyleMatch table) {
        return resolver.resolveWithin(visit.context, visit.token, visit.ancestry, table);
    }

    private void pushChildren(Token parent, Work visit, StyleMatch table, int listDepth, Deque<Work> work) {
        List<Token> children = parent.children();
        if (children.isEmpty()) {
            return;
        }
        List<String> ancestry = extend(visit.ancestry, parent.kindKey());
        Style context = resolver.descend(visit.context, visit.ancestry, parent.kindKey(), table);
        for (int i = children.size() - 1; i >= 0; i--) {
            work.push(Work.visit(children.get(i), ancestry, context, listDepth));
        }
    }

    private static List<String> extend(List<String> ancestry, String kindKey) {
        List<String> extended = new ArrayList<>(ancestry.size() + 1);
        extended.addAll(ancestry);
        extended.add(kindKey);
        return List.copyOf(extended);
    }

    private static final class Work {

        private final Token token;
        private final List<String> ancestry;
        private final Style context;
        private final int listDepth;
        private final StyledElement element;

        private Work(Token token, List<String> ancestry, Style context, int listDepth, StyledElement element) {
            this.token = token;
            this.ancestry = ancestry;
            this.context = context;
            this.listDepth = listDepth;
            this.element = element;
        }

        static Work visit(Token token, List<String> ancestry, Style context, int listDepth) {
            return new Work(token, ancestry, context, listDepth, null);
        }

        static Work emit(StyledElement element) {
            return new Work(null, List.of(), null, 0, element);
        }
    }
}
