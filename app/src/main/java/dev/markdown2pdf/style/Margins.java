package dev.markdown2pdf.style;

/**
 * Page margins in millimetres.
 */
public record Margins(double top, double right, double bottom, double left) {

    public static final double DEFAULT_MARGIN = 8.0;

    public Margins {
        requireNonNegative(top, "top");
        requireNonNegative(right, "right");
        requireNonNegative(bottom, "bottom");
        requireNonNegative(left, "left");
    }

    public static Margins defaults() {
        return new Margins(DEFAULT_MARGIN, DEFAULT_MARGIN, DEFAULT_MARGIN, DEFAULT_MARGIN);
    }

    private static void requireNonNegative(double value, String side) {
        if (value < 0) {
            throw new IllegalArgumentException(side + " margin must not be negative");
        }
    }
}
