package com.tessera.core.parser;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-level helpers shared by the text strategies.
 */
final class TextLines {

    static final Pattern ITEM_HEADER = Pattern.compile(
            "^\\s*(?:#{1,6}\\s*)?(?:[*_]{1,2})?\\s*(task|item|tarea|activity|actividad)\\s*#?\\s*(\\d+)\\s*(?:[*_]{1,2})?\\s*[:.)\\-]?\\s*(?:[*_]{1,2})?\\s*(.*)$",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private static final Pattern BULLET = Pattern.compile("^\\s*(?:[-*•+>]|\\d+[.)])\\s+");
    private static final Pattern MARKDOWN = Pattern.compile("[*_`#]+");

    /**
     * A {@code key: value} or {@code key - value} pair found on a line.
     */
    record KeyValue(String key, String value) {}

    private TextLines() {} // utility class

    static List<String> lines(String text) {
        return List.of(text.split("\\R", -1));
    }

    /**
     * Matches an item header such as {@code TASK 2: Measure the room}.
     */
    static Optional<Matcher> itemHeader(String line) {
        Matcher m = ITEM_HEADER.matcher(line);
        return m.matches() ? Optional.of(m) : Optional.empty();
    }

    /**
     * Draft id for a matched header, e.g. {@code task 2}. The ordinal stays textual so that
     * arbitrarily long numbers never overflow.
     */
    static String headerId(Matcher header) {
        String digits = header.group(2).replaceFirst("^0+(?=\\d)", "");
        return header.group(1).toLowerCase(Locale.ROOT) + " " + digits;
    }

    static String stripBullet(String line) {
        return BULLET.matcher(line).replaceFirst("");
    }

    /**
     * Line with list markers and markdown emphasis removed and whitespace collapsed.
     */
    static String plain(String line) {
        String s = stripBullet(line.trim());
        s = MARKDOWN.matcher(s).replaceAll("");
        return s.replaceAll("\\s+", " ").trim();
    }

    static Optional<KeyValue> colonPair(String line) {
        String s = stripBullet(line.trim());
        int colon = s.indexOf(':');
        if (colon <= 0) {
            return Optional.empty();
        }
        String key = MARKDOWN.matcher(s.substring(0, colon)).replaceAll("").trim();
        String value = s.substring(colon + 1);
        value = value.replaceFirst("^\\s*[*_]{1,2}", "").trim();
        if (key.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new KeyValue(key, value));
    }

    static Optional<KeyValue> dashPair(String line) {
        String s = stripBullet(line.trim());
        int dash = s.indexOf(" - ");
        if (dash <= 0) {
            return Optional.empty();
        }
        String key = MARKDOWN.matcher(s.substring(0, dash)).replaceAll("").trim();
        return Optional.of(new KeyValue(key, s.substring(dash + 3).trim()));
    }

    static int wordCount(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }
}
