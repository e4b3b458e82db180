package com.tessera.core.normalize;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient readers for the field values that show up in generated text
 * ("3/5", "about 2 hours", "collaboration, research").
 */
public final class FieldValues {

    private static final Pattern NUMBER = Pattern.compile("(\\d+(?:[.,]\\d+)?)");
    private static final Pattern TRAILING_NUMBER = Pattern.compile("(\\d+)\\s*$");
    private static final Pattern LIST_SEPARATOR = Pattern.compile("\\s*(?:[,;/|]|\\band\\b|\\by\\b)\\s*");
    private static final Pattern TAG_SPACING = Pattern.compile("[\\s_]+");

    private static final int MINUTES_PER_HOUR = 60;
    private static final int MINUTES_PER_SESSION = 45;

    /** Longest duration a single item may claim: one day. */
    public static final int MAX_DURATION_MINUTES = 24 * MINUTES_PER_HOUR;

    private static final Set<String> NONE_MARKERS = Set.of(
            "none", "no", "n/a", "na", "-", "ninguna", "ninguno", "nada", "null");

    private FieldValues() {} // utility class

    /**
     * First integer in the value; decimals are rounded half up and values past the int range
     * saturate at {@link Integer#MAX_VALUE}.
     */
    public static Optional<Integer> firstInteger(String value) {
        if (value == null) {
            return Optional.empty();
        }
        Matcher m = NUMBER.matcher(value);
        if (!m.find()) {
            return Optional.empty();
        }
        try {
            double parsed = Double.parseDouble(m.group(1).replace(',', '.'));
            return Optional.of((int) Math.min(Math.round(parsed), Integer.MAX_VALUE));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Duration in minutes. A bare number is minutes; hours multiply by 60 and sessions by 45.
     * The result is capped at {@link #MAX_DURATION_MINUTES}.
     */
    public static Optional<Integer> durationMinutes(String value) {
        if (value == null) {
            return Optional.empty();
        }
        Matcher m = NUMBER.matcher(value);
        if (!m.find()) {
            return Optional.empty();
        }
        double amount;
        try {
            amount = Double.parseDouble(m.group(1).replace(',', '.'));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        String unit = value.substring(m.end()).toLowerCase(Locale.ROOT);
        double minutes;
        if (unit.trim().startsWith("min")) {
            minutes = amount;
        } else if (unit.contains("hour") || unit.contains("hora") || unit.trim().startsWith("h")) {
            minutes = amount * MINUTES_PER_HOUR;
        } else if (unit.contains("session") || unit.contains("sesi")) {
            minutes = amount * MINUTES_PER_SESSION;
        } else {
            minutes = amount;
        }
        int rounded = (int) Math.min(Math.round(minutes), MAX_DURATION_MINUTES);
        return rounded > 0 ? Optional.of(rounded) : Optional.empty();
    }

    /**
     * Splits a list value on commas, semicolons, slashes, pipes and the words "and"/"y".
     * Blank entries and "none" markers are dropped.
     */
    public static Set<String> splitList(String value) {
        var out = new LinkedHashSet<String>();
        if (value == null || value.isBlank()) {
            return out;
        }
        for (String part : LIST_SEPARATOR.split(value.trim())) {
            String cleaned = stripDecoration(part);
            if (!cleaned.isEmpty() && !isNone(cleaned)) {
                out.add(cleaned);
            }
        }
        return out;
    }

    /**
     * Competency or support tag form: trimmed, lower case, inner whitespace and
     * underscores as single hyphens. Idempotent.
     */
    public static String normalizeTag(String tag) {
        if (tag == null) {
            return "";
        }
        String trimmed = stripDecoration(tag).toLowerCase(Locale.ROOT);
        return TAG_SPACING.matcher(trimmed).replaceAll("-");
    }

    public static Set<String> normalizeTags(Set<String> tags) {
        var out = new LinkedHashSet<String>();
        if (tags == null) {
            return out;
        }
        for (String tag : tags) {
            String normalized = normalizeTag(tag);
            if (!normalized.isEmpty()) {
                out.add(normalized);
            }
        }
        return out;
    }

    /**
     * Trailing integer of a reference like "task 2" or "tarea_02".
     */
    public static Optional<Integer> trailingOrdinal(String reference) {
        if (reference == null) {
            return Optional.empty();
        }
        Matcher m = TRAILING_NUMBER.matcher(reference.trim());
        if (!m.find()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Integer.parseInt(m.group(1)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public static boolean isNone(String value) {
        return value == null || NONE_MARKERS.contains(value.trim().toLowerCase(Locale.ROOT));
    }

    static String stripDecoration(String value) {
        String s = value.trim();
        while (!s.isEmpty() && "*_`\"'[]().".indexOf(s.charAt(0)) >= 0) {
            s = s.substring(1).trim();
        }
        while (!s.isEmpty() && "*_`\"'[]().".indexOf(s.charAt(s.length() - 1)) >= 0) {
            s = s.substring(0, s.length() - 1).trim();
        }
        return s;
    }
}
