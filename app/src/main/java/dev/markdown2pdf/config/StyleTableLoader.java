package dev.markdown2pdf.config;

import dev.markdown2pdf.style.Color;
import dev.markdown2pdf.style.Margins;
import dev.markdown2pdf.style.Style;
import dev.markdown2pdf.style.StyleMatch;
import dev.markdown2pdf.style.TextAlignment;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Reads a TOML style file into a {@link StyleMatch}.
 *
 * <p>Besides the kind keys ({@code [paragraph]}, {@code ["list-item.italic"]}) the loader understands the
 * section names of the classic markdown2pdfrc format: {@code [text]}, {@code [emphasis]},
 * {@code [strong_emphasis]}, {@code [code]}, {@code [block_quote]}, {@code [list_item]},
 * {@code [horizontal_rule]}, {@code [heading.N]} and {@code [margin]}. A missing or unparsable file yields the
 * built-in styles; a property of the wrong type is skipped. Both are logged as warnings.
 */
public class StyleTableLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(StyleTableLoader.class);

    private static final Map<String, List<String>> ALIASES = Map.of(
            "text", List.of("document"),
            "emphasis", List.of("italic"),
            "strong_emphasis", List.of("bold"),
            "code", List.of("code-span", "code-block"),
            "block_quote", List.of("block-quote"),
            "list_item", List.of("list-item"),
            "horizontal_rule", List.of("horizontal-rule"));

    private static final String MARGIN_SECTION = "margin";
    private static final String HEADING_SECTION = "heading";
    private static final int MAX_HEADING_LEVEL = 6;

    public StyleMatch load(Path path, boolean explicit) {
        Objects.requireNonNull(path, "path");
        if (!Files.exists(path)) {
            if (explicit) {
                LOGGER.warn("Style file {} does not exist; using built-in styles", path);
            } else {
                LOGGER.debug("No style file at {}; using built-in styles", path);
            }
            return StyleMatch.defaults();
        }
        String toml;
        try {
            toml = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read style file " + path, ex);
        }
        StyleMatch table = parse(toml, path.toString());
        LOGGER.debug("Loaded {} style entries from {}", table.entries().size(), path);
        return table;
    }

    public StyleMatch parse(String toml) {
        return parse(toml, "inline style table");
    }

    private StyleMatch parse(String toml, String origin) {
        Objects.requireNonNull(toml, "toml");
        TomlParseResult result = Toml.parse(toml);
        if (result.hasErrors()) {
            LOGGER.warn("{} is not valid TOML ({}); using built-in styles", origin, result.errors().get(0).toString());
            return StyleMatch.defaults();
        }
        Map<String, Style> entries = new LinkedHashMap<>();
        Margins margins = Margins.defaults();
        for (String section : result.keySet()) {
            Object value = result.get(List.of(section));
            if (!(value instanceof TomlTable table)) {
                LOGGER.warn("Ignoring top-level value '{}' in {}: expected a table", section, origin);
                continue;
            }
            switch (section) {
                case MARGIN_SECTION -> margins = margins(table, origin);
                case HEADING_SECTION -> readHeadings(table, origin, entries);
                default -> {
                    Style style = style(table, section, origin);
                    for (String key : ALIASES.getOrDefault(section, List.of(section))) {
                        entries.merge(key, style, Style::merge);
                    }
                }
            }
        }
        return new StyleMatch(entries, margins);
    }

    private void readHeadings(TomlTable headings, String origin, Map<String, Style> entries) {
        for (String level : headings.keySet()) {
            Object value = headings.get(List.of(level));
            if (!(value instanceof TomlTable table) || !isHeadingLevel(level)) {
                LOGGER.warn("Ignoring '{}.{}' in {}: expected a table named 1 to {}",
                        HEADING_SECTION, level, origin, MAX_HEADING_LEVEL);
                continue;
            }
            entries.merge("heading-" + level, style(table, HEADING_SECTION + "." + level, origin), Style::merge);
        }
    }

    private Margins margins(TomlTable table, String origin) {
        double top = margin(table, "top", origin);
        double right = margin(table, "right", origin);
        double bottom = margin(table, "bottom", origin);
        double left = margin(table, "left", origin);
        return new Margins(top, right, bottom, left);
    }

    private double margin(TomlTable table, String side, String origin) {
        Object value = table.get(List.of(side));
        if (value == null) {
            return Margins.DEFAULT_MARGIN;
        }
        Optional<Double> number = number(value).filter(margin -> margin >= 0);
        if (number.isEmpty()) {
            warnMistyped(origin, MARGIN_SECTION, side, value, "a non-negative number");
        }
        return number.orElse(Margins.DEFAULT_MARGIN);
    }

    private Style style(TomlTable table, String section, String origin) {
        Style.Builder builder = Style.builder();
        for (String property : table.keySet()) {
            Object value = table.get(List.of(property));
            switch (property) {
                case "size" -> number(value).filter(size -> size > 0).ifPresentOrElse(builder::size,
                        () -> warnMistyped(origin, section, property, value, "a positive number"));
                case "afterspacing" -> number(value).filter(spacing -> spacing >= 0).ifPresentOrElse(
                        builder::afterSpacing,
                        () -> warnMistyped(origin, section, property, value, "a non-negative number"));
                case "textcolor" -> color(value).ifPresentOrElse(builder::textColor,
                        () -> warnMistyped(origin, section, property, value, "a table {r, g, b} of 0-255 values"));
                case "backgroundcolor" -> color(value).ifPresentOrElse(builder::backgroundColor,
                        () -> warnMistyped(origin, section, property, value, "a table {r, g, b} of 0-255 values"));
                case "alignment" -> string(value).map(TextAlignment::from).ifPresentOrElse(builder::alignment,
                        () -> warnMistyped(origin, section, property, value, "a string"));
                case "fontfamily" -> string(value).filter(family -> !family.isBlank()).ifPresentOrElse(
                        builder::fontFamily,
                        () -> warnMistyped(origin, section, property, value, "a font name"));
                case "bold" -> flag(value).ifPresentOrElse(builder::bold,
                        () -> warnMistyped(origin, section, property, value, "a boolean"));
                case "italic" -> flag(value).ifPresentOrElse(builder::italic,
                        () -> warnMistyped(origin, section, property, value, "a boolean"));
                case "underline" -> flag(value).ifPresentOrElse(builder::underline,
                        () -> warnMistyped(origin, section, property, value, "a boolean"));
                case "strikethrough" -> flag(value).ifPresentOrElse(builder::strikethrough,
                        () -> warnMistyped(origin, section, property, value, "a boolean"));
                default -> LOGGER.warn("Ignoring unknown style property '{}.{}' in {}", section, property, origin);
            }
        }
        return builder.build();
    }

    private static Optional<Double> number(Object value) {
        if (value instanceof Long longValue) {
            return Optional.of(longValue.doubleValue());
        }
        if (value instanceof Double doubleValue) {
            return Optional.of(doubleValue);
        }
        return Optional.empty();
    }

    private static Optional<String> string(Object value) {
        return value instanceof String text ? Optional.of(text) : Optional.empty();
    }

    private static Optional<Boolean> flag(Object value) {
        return value instanceof Boolean bool ? Optional.of(bool) : Optional.empty();
    }

    private static Optional<Color> color(Object value) {
        if (!(value instanceof TomlTable table)) {
            return Optional.empty();
        }
        Optional<Integer> red = channel(table.get(List.of("r")));
        Optional<Integer> green = channel(table.get(List.of("g")));
        Optional<Integer> blue = channel(table.get(List.of("b")));
        if (red.isEmpty() || green.isEmpty() || blue.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Color(red.get(), green.get(), blue.get()));
    }

    private static Optional<Integer> channel(Object value) {
        if (value instanceof Long longValue && longValue >= 0 && longValue <= 255) {
            return Optional.of(longValue.intValue());
        }
        return Optional.empty();
    }

    private static boolean isHeadingLevel(String level) {
        return level.length() == 1 && level.charAt(0) >= '1' && level.charAt(0) <= '0' + MAX_HEADING_LEVEL;
    }

    private static void warnMistyped(String origin, String section, String property, Object value, String expected) {
        LOGGER.warn("Ignoring '{}.{}' in {}: expected {} but got {}", section, property, origin, expected, value);
    }
}
