package dev.markdown2pdf.style;

/**
 * An RGB color with 8-bit channels.
 */
public record Color(int red, int green, int blue) {

    public static final Color BLACK = new Color(0, 0, 0);

    public Color {
        red = requireChannel(red, "red");
        green = requireChannel(green, "green");
        blue = requireChannel(blue, "blue");
    }

    private static int requireChannel(int value, String channel) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException(channel + " must be between 0 and 255 but was " + value);
        }
        return value;
    }
}
