package dev.markdown2pdf.style;

import java.util.Map;

/**
 * Built-in styles applied beneath the style table.
 */
public final class DefaultStyles {

    public static final Style BASE = Style.builder()
            .fontFamily("helvetica")
            .size(12)
            .bold(false)
            .italic(false)
            .underline(false)
            .strikethrough(false)
            .textColor(Color.BLACK)
            .afterSpacing(0)
            .alignment(TextAlignment.LEFT)
            .build();

    private static final Color GRAY = new Color(96, 96, 96);

    private static final Map<String, Style> DEFAULTS = Map.ofEntries(
            Map.entry("heading-1", heading(24, 1.0)),
            Map.entry("heading-2", heading(20, 0.8)),
            Map.entry("heading-3", heading(16, 0.6)),
            Map.entry("heading-4", heading(14, 0.5)),
            Map.entry("heading-5", heading(13, 0.4)),
            Map.entry("heading-6", heading(12, 0.4)),
            Map.entry("paragraph", Style.builder().afterSpacing(0.5).build()),
            Map.entry("italic", Style.builder().italic(true).build()),
            Map.entry("bold", Style.builder().bold(true).build()),
            Map.entry("bold-italic", Style.builder().bold(true).italic(true).build()),
            Map.entry("code-span", Style.builder()
                    .fontFamily("courier")
                    .backgroundColor(new Color(240, 240, 240))
                    .build()),
            Map.entry("code-block", Style.builder()
                    .fontFamily("courier")
                    .size(10)
                    .backgroundColor(new Color(245, 245, 245))
                    .afterSpacing(0.6)
                    .build()),
            Map.entry("link", Style.builder().textColor(new Color(0, 0, 238)).underline(true).build()),
            Map.entry("image", Style.builder().italic(true).textColor(GRAY).build()),
            Map.entry("list", Style.builder().afterSpacing(0.5).build()),
            Map.entry("block-quote", Style.builder().italic(true).textColor(GRAY).afterSpacing(0.5).build()),
            Map.entry("horizontal-rule", Style.builder()
                    .textColor(new Color(160, 160, 160))
                    .afterSpacing(0.5)
                    .build()));

    private DefaultStyles() {
    }

    public static Style forKind(String kindKey) {
        return DEFAULTS.getOrDefault(kindKey, Style.empty());
    }

    private static Style heading(double size, double afterSpacing) {
        return Style.builder().size(size).bold(true).afterSpacing(afterSpacing).build();
    }
}
