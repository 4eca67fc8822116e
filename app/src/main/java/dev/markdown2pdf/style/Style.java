package dev.markdown2pdf.style;

import java.util.Optional;

/**
 * A partial style: every property is optional and an absent property leaves the underlying value untouched.
 */
public record Style(
        Optional<String> fontFamily,
        Optional<Double> size,
        Optional<Boolean> bold,
        Optional<Boolean> italic,
        Optional<Boolean> underline,
        Optional<Boolean> strikethrough,
        Optional<Color> textColor,
        Optional<Color> backgroundColor,
        Optional<Double> afterSpacing,
        Optional<TextAlignment> alignment) {

    private static final Style EMPTY = builder().build();

    public Style {
        fontFamily = fontFamily == null ? Optional.empty() : fontFamily;
        size = size == null ? Optional.empty() : size;
        bold = bold == null ? Optional.empty() : bold;
        italic = italic == null ? Optional.empty() : italic;
        underline = underline == null ? Optional.empty() : underline;
        strikethrough = strikethrough == null ? Optional.empty() : strikethrough;
        textColor = textColor == null ? Optional.empty() : textColor;
        backgroundColor = backgroundColor == null ? Optional.empty() : backgroundColor;
        afterSpacing = afterSpacing == null ? Optional.empty() : afterSpacing;
        alignment = alignment == null ? Optional.empty() : alignment;
        size.ifPresent(value -> requirePositive(value, "size"));
        afterSpacing.ifPresent(value -> {
            if (value < 0) {
                throw new IllegalArgumentException("afterSpacing must not be negative");
            }
        });
    }

    public static Style empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return equals(EMPTY);
    }

    /**
     * Returns a style whose properties are taken from {@code override} where present and from this style otherwise.
     */
    public Style merge(Style override) {
        if (override == null || override.isEmpty()) {
            return this;
        }
        return new Style(
                override.fontFamily.or(() -> fontFamily),
                override.size.or(() -> size),
                override.bold.or(() -> bold),
                override.italic.or(() -> italic),
                override.underline.or(() -> underline),
                override.strikethrough.or(() -> strikethrough),
                override.textColor.or(() -> textColor),
                override.backgroundColor.or(() -> backgroundColor),
                override.afterSpacing.or(() -> afterSpacing),
                override.alignment.or(() -> alignment));
    }

    private static void requirePositive(double value, String field) {
        if (value <= 0) {
            throw new IllegalArgumentException(field + " must be positive");
        }
    }

    public static final class Builder {

        private String fontFamily;
        private Double size;
        private Boolean bold;
        private Boolean italic;
        private Boolean underline;
        private Boolean strikethrough;
        private Color textColor;
        private Color backgroundColor;
        private Double afterSpacing;
        private TextAlignment alignment;

        private Builder() {
        }

        public Builder fontFamily(String fontFamily) {
            this.fontFamily = fontFamily;
            return this;
        }

        public Builder size(double size) {
            this.size = size;
            return this;
        }

        public Builder bold(boolean bold) {
            this.bold = bold;
            return this;
        }

        public Builder italic(boolean italic) {
            this.italic = italic;
            return this;
        }

        public Builder underline(boolean underline) {
            this.underline = underline;
            return this;
        }

        public Builder strikethrough(boolean strikethrough) {
            this.strikethrough = strikethrough;
            return this;
        }

        public Builder textColor(Color textColor) {
            this.textColor = textColor;
            return this;
        }

        public Builder backgroundColor(Color backgroundColor) {
            this.backgroundColor = backgroundColor;
            return this;
        }

        public Builder afterSpacing(double afterSpacing) {
            this.afterSpacing = afterSpacing;
            return this;
        }

        public Builder alignment(TextAlignment alignment) {
            this.alignment = alignment;
            return this;
        }

        public Style build() {
            return new Style(
                    Optional.ofNullable(fontFamily),
                    Optional.ofNullable(size),
                    Optional.ofNullable(bold),
                    Optional.ofNullable(italic),
                    Optional.ofNullable(underline),
                    Optional.ofNullable(strikethrough),
                    Optional.ofNullable(textColor),
                    Optional.ofNullable(backgroundColor),
                    Optional.ofNullable(afterSpacing),
                    Optional.ofNullable(alignment));
        }
    }
}
