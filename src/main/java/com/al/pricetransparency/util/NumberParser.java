package com.al.pricetransparency.util;

import java.util.regex.Pattern;

/**
 * Lenient numeric cell parsing for price files.
 *
 * <p>
 * Currency symbols, thousands separators and whitespace are stripped before
 * parsing. Empty or non-numeric input yields {@code null}, never zero.
 */
public final class NumberParser {

    private static final Pattern NOISE = Pattern.compile("[$,\\s]");

    private NumberParser() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    public static Double parse(String raw) {
        if (raw == null) {
            return null;
        }
        String cleaned = NOISE.matcher(raw).replaceAll("");
        if (cleaned.isEmpty()) {
            return null;
        }
        try {
            double value = Double.parseDouble(cleaned);
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                return null;
            }
            return value;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static boolean isNumeric(String raw) {
        return parse(raw) != null;
    }

    /**
     * Returns the trimmed value, or null when blank.
     */
    public static String trimToNull(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
