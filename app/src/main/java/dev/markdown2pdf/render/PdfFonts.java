package dev.markdown2pdf.render;

import dev.markdown2pdf.style.ResolvedStyle;
import java.io.IOException;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;

/**
 * Maps style font families onto the standard 14 PDF fonts and keeps text within what they can encode.
 */
final class PdfFonts {

    static final char REPLACEMENT = '?';

    private final Map<Standard14Fonts.FontName, PDFont> fonts = new EnumMap<>(Standard14Fonts.FontName.class);
    private final Map<Standard14Fonts.FontName, Map<Character, Boolean>> encodable =
            new EnumMap<>(Standard14Fonts.FontName.class);

    PDFont font(ResolvedStyle style) {
        return fonts.computeIfAbsent(fontName(style.fontFamily(), style.bold(), style.italic()), PDType1Font::new);
    }

    float width(PDFont font, String text, float size) throws IOException {
        return font.getStringWidth(text) / 1000f * size;
    }

    /**
     * Replaces characters the font cannot encode with {@value #REPLACEMENT} and control characters with spaces.
     */
    String sanitize(ResolvedStyle style, String text) throws IOException {
        Standard14Fonts.FontName name = fontName(style.fontFamily(), style.bold(), style.italic());
        PDFont font = font(style);
        Map<Character, Boolean> known = encodable.computeIfAbsent(name, key -> new HashMap<>());
        StringBuilder builder = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); ) {
            int codePoint = text.codePointAt(i);
            i += Character.charCount(codePoint);
            if (codePoint > Character.MAX_VALUE) {
                builder.append(REPLACEMENT);
                continue;
            }
            char ch = (char) codePoint;
            if (Character.isISOControl(ch)) {
                builder.append(' ');
                continue;
            }
            Boolean supported = known.get(ch);
            if (supported == null) {
                supported = canEncode(font, ch);
                known.put(ch, supported);
            }
            builder.append(supported ? ch : REPLACEMENT);
        }
        return builder.toString();
    }

    static Standard14Fonts.FontName fontName(String family, boolean bold, boolean italic) {
        String normalized = family.toLowerCase(Locale.ROOT);
        if (normalized.contains("courier") || normalized.contains("mono")) {
            return variant(bold, italic, Standard14Fonts.FontName.COURIER, Standard14Fonts.FontName.COURIER_BOLD,
                    Standard14Fonts.FontName.COURIER_OBLIQUE, Standard14Fonts.FontName.COURIER_BOLD_OBLIQUE);
        }
        if (normalized.contains("times") || (normalized.contains("serif") && !normalized.contains("sans"))) {
            return variant(bold, italic, Standard14Fonts.FontName.TIMES_ROMAN, Standard14Fonts.FontName.TIMES_BOLD,
                    Standard14Fonts.FontName.TIMES_ITALIC, Standard14Fonts.FontName.TIMES_BOLD_ITALIC);
        }
        return variant(bold, italic, Standard14Fonts.FontName.HELVETICA, Standard14Fonts.FontName.HELVETICA_BOLD,
                Standard14Fonts.FontName.HELVETICA_OBLIQUE, Standard14Fonts.FontName.HELVETICA_BOLD_OBLIQUE);
    }

    private static Standard14Fonts.FontName variant(boolean bold, boolean italic, Standard14Fonts.FontName regular,
            Standard14Fonts.FontName boldFont, Standard14Fonts.FontName italicFont,
            Standard14Fonts.FontName boldItalicFont) {
        if (bold && italic) {
            return boldItalicFont;
        }
        if (bold) {
            return boldFont;
        }
        return italic ? italicFont : regular;
    }

    private static boolean canEncode(PDFont font, char ch) throws IOException {
        try {
            font.encode(String.valueOf(ch));
            return true;
        } catch (IllegalArgumentException ex) {
            return false;
        }
    }
}
