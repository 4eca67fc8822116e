package dev.markdown2pdf.style;

import dev.markdown2pdf.token.Token;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves the concrete style of a token from its ancestry and a style table.
 *
 * <p>Starting from {@link DefaultStyles#BASE}, one layer is applied for every ancestor, root first, and a
 * last one for the token itself. A layer is the built-in default for the kind, then the table entry for the
 * kind key, then the table entry for the most specific composite key ending in the kind. The token's inline
 * override, if any, is applied last. Every property is last-writer-wins.
 *
 * <p>Tree walks can carry the accumulated ancestor style along with {@link #descend} and finish with
 * {@link #resolveWithin}, which yields the same result as {@link #resolve} without re-merging the ancestry
 * for every node.
 */
public class StyleResolver {

    static final String KEY_SEPARATOR = ".";

    public ResolvedStyle resolve(Token token, List<String> ancestry, StyleMatch table) {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(ancestry, "ancestry");
        Objects.requireNonNull(table, "table");
        Style context = DefaultStyles.BASE;
        for (int i = 0; i < ancestry.size(); i++) {
            context = descend(context, ancestry.subList(0, i), ancestry.get(i), table);
        }
        return resolveWithin(context, token, ancestry, table);
    }

    /**
     * Applies the layer of the ancestor {@code kindKey}, found below {@code chain}, to {@code context}.
     */
    public Style descend(Style context, List<String> chain, String kindKey, StyleMatch table) {
        return context.merge(layer(kindKey, chain, table));
    }

    /**
     * Resolves {@code token} given the style accumulated from all of its ancestors.
     */
    public ResolvedStyle resolveWithin(Style context, Token token, List<String> ancestry, StyleMatch table) {
        Style style = context.merge(layer(token.kindKey(), ancestry, table));
        style = style.merge(token.inlineStyle().orElse(Style.empty()));
        return ResolvedStyle.from(style);
    }

    private Style layer(String kindKey, List<String> chain, StyleMatch table) {
        Style style = DefaultStyles.forKind(kindKey);
        style = style.merge(table.lookup(kindKey).orElse(Style.empty()));
        return style.merge(mostSpecificComposite(kindKey, chain, table).orElse(Style.empty()));
    }

    private Optional<Style> mostSpecificComposite(String kindKey, List<String> chain, StyleMatch table) {
        int longestSuffix = table.longestCompositeKey() - 1;
        if (longestSuffix <= 0) {
            return Optional.empty();
        }
        for (int start = Math.max(0, chain.size() - longestSuffix); start < chain.size(); start++) {
            String key = String.join(KEY_SEPARATOR, chain.subList(start, chain.size())) + KEY_SEPARATOR + kindKey;
            Optional<Style> entry = table.lookup(key);
            if (entry.isPresent()) {
                return entry;
            }
        }
        return Optional.empty();
    }
}
