package dev.markdown2pdf.style;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The style table: partial styles keyed by kind key ({@code "heading-1"}) or composite key
 * ({@code "list-item.italic"}), plus the page margins.
 */
public record StyleMatch(Map<String, Style> entries, Margins margins) {

    public StyleMatch {
        entries = Map.copyOf(Objects.requireNonNull(entries, "entries"));
        Objects.requireNonNull(margins, "margins");
    }

    public static StyleMatch defaults() {
        return new StyleMatch(Map.of(), Margins.defaults());
    }

    public Optional<Style> lookup(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    /**
     * Number of kind keys in the longest composite key of the table; 1 when there are only plain keys.
     */
    public int longestCompositeKey() {
        int longest = entries.isEmpty() ? 0 : 1;
        for (String key : entries.keySet()) {
            int parts = 1;
            for (int i = 0; i < key.length(); i++) {
                if (key.charAt(i) == '.') {
                    parts++;
                }
            }
            longest = Math.max(longest, parts);
        }
        return longest;
    }
}
