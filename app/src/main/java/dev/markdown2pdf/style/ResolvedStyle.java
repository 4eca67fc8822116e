package dev.markdown2pdf.style;

import java.util.Objects;
import java.util.Optional;

/**
 * The concrete style of one output element. Sizes are in points, after-spacing in lines.
 */
public record ResolvedStyle(
        String fontFamily,
        double size,
        boolean bold,
        boolean italic,
        boolean underline,
        boolean strikethrough,
        Color textColor,
        Optional<Color> backgroundColor,
        double afterSpacing,
        TextAlignment alignment) {

    public ResolvedStyle {
        Objects.requireNonNull(fontFamily, "fontFamily");
        Objects.requireNonNull(textColor, "textColor");
        Objects.requireNonNull(alignment, "alignment");
        backgroundColor = backgroundColor == null ? Optional.empty() : backgroundColor;
        if (size <= 0) {
            throw new IllegalArgumentException("size must be positive");
        }
    }

    /**
     * Completes a partial style. {@code base} must define every property except the background color.
     */
    public static ResolvedStyle from(Style base) {
        Objects.requireNonNull(base, "base");
        return new ResolvedStyle(
                require(base.fontFamily(), "fontFamily"),
                require(base.size(), "size"),
                require(base.bold(), "bold"),
                require(base.italic(), "italic"),
                require(base.underline(), "underline"),
                require(base.strikethrough(), "strikethrough"),
                require(base.textColor(), "textColor"),
                base.backgroundColor(),
                require(base.afterSpacing(), "afterSpacing"),
                require(base.alignment(), "alignment"));
    }

    public ResolvedStyle withOverride(Style override) {
        if (override == null || override.isEmpty()) {
            return this;
        }
        return from(toStyle().merge(override));
    }

    public Style toStyle() {
        return new Style(
                Optional.of(fontFamily),
                Optional.of(size),
                Optional.of(bold),
                Optional.of(italic),
                Optional.of(underline),
                Optional.of(strikethrough),
                Optional.of(textColor),
                backgroundColor,
                Optional.of(afterSpacing),
                Optional.of(alignment));
    }

    private static <T> T require(Optional<T> value, String property) {
        return value.orElseThrow(() -> new IllegalArgumentException("Base style is missing " + property));
    }
}
