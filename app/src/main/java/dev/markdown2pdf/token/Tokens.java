package dev.markdown2pdf.token;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Helpers over token trees.
 */
public final class Tokens {

    private Tokens() {
    }

    /**
     * Concatenates the visible text of the given tokens and their descendants in document order.
     */
    public static String plainText(List<Token> tokens) {
        StringBuilder builder = new StringBuilder();
        Deque<Token> pending = new ArrayDeque<>();
        for (int i = tokens.size() - 1; i >= 0; i--) {
            pending.push(tokens.get(i));
        }
        while (!pending.isEmpty()) {
            Token token = pending.pop();
            if (token instanceof Text text) {
                builder.append(text.content());
            } else if (token instanceof Literal literal) {
                builder.append(literal.content());
            } else if (token instanceof CodeSpan codeSpan) {
                builder.append(codeSpan.content());
            } else if (token instanceof Image image) {
                builder.append(image.alt());
            } else {
                List<Token> children = token.children();
                for (int i = children.size() - 1; i >= 0; i--) {
                    pending.push(children.get(i));
                }
            }
        }
        return builder.toString();
    }
}
