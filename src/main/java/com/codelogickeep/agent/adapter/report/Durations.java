package com.codelogickeep.agent.adapter.report;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes report duration encodings to milliseconds.
 * <ul>
 *   <li>bare numbers are seconds</li>
 *   <li>{@code "150ms"} is milliseconds, {@code "2.5s"} is seconds</li>
 *   <li>{@code H:MM:SS.fraction} needs exactly three colon-separated parts</li>
 * </ul>
 * Anything unparseable becomes {@code 0.0}.
 */
public final class Durations {
    private static final double MS_PER_SECOND = 1000.0;
    private static final int CLOCK_PARTS = 3;
    // Plain decimals only; Double.parseDouble would also take "2f", "0x1p3" or "NaN".
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    /**
     * TRX only: bare numbers at or above this value are taken as milliseconds already.
     */
    static final double TRX_BARE_MILLIS_THRESHOLD = 1000.0;

    private Durations() {
    }

    public static double toMillis(String value) {
        if (value == null) {
            return 0.0;
        }
        String text = value.trim().toLowerCase(Locale.ROOT);
        if (text.isEmpty()) {
            return 0.0;
        }
        if (text.contains(":")) {
            return clockToMillis(text);
        }
        try {
            if (text.endsWith("ms")) {
                return parseDecimal(text.substring(0, text.length() - 2).trim());
            }
            if (text.endsWith("s")) {
                return parseDecimal(text.substring(0, text.length() - 1).trim()) * MS_PER_SECOND;
            }
            return parseDecimal(text) * MS_PER_SECOND;
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    public static double toMillis(double seconds) {
        return seconds * MS_PER_SECOND;
    }

    public static double toMillis(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return 0.0;
        }
        if (node.isNumber()) {
            return toMillis(node.asDouble());
        }
        if (node.isTextual()) {
            return toMillis(node.asText());
        }
        return 0.0;
    }

    /**
     * TRX durations: clock strings as usual; bare numbers below 1000 are seconds, at or
     * above 1000 are assumed to be milliseconds. A run lasting 1000 seconds or more is
     * therefore misread; the behaviour is kept for compatibility with existing reports.
     */
    public static double trxToMillis(String value) {
        if (value == null) {
            return 0.0;
        }
        String text = value.trim();
        if (text.contains(":")) {
            return clockToMillis(text);
        }
        try {
            return trxToMillis(parseDecimal(text));
        } catch (NumberFormatException e) {
            return toMillis(text);
        }
    }

    public static double trxToMillis(double value) {
        return value < TRX_BARE_MILLIS_THRESHOLD ? value * MS_PER_SECOND : value;
    }

    /**
     * {@code "0:01:02.5"} is 62 500 ms. Any other number of colon parts yields 0.0.
     */
    public static double clockToMillis(String text) {
        String[] parts = text.trim().split(":", -1);
        if (parts.length != CLOCK_PARTS) {
            return 0.0;
        }
        try {
            double hours = parseDecimal(parts[0]);
            double minutes = parseDecimal(parts[1]);
            double seconds = parseDecimal(parts[2]);
            return (hours * 3600 + minutes * 60 + seconds) * MS_PER_SECOND;
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    private static double parseDecimal(String text) {
        String trimmed = text.trim();
        if (!DECIMAL.matcher(trimmed).matches()) {
            throw new NumberFormatException("Not a decimal number: " + text);
        }
        return Double.parseDouble(trimmed);
    }
}
