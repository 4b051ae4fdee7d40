package io.github.jakubt4.astrocat.source;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Types raw delimited-text cells: missing markers become {@code null}, integers {@link Long},
 * decimals {@link Double}, everything else stays a {@link String}.
 */
final class CellValues {

    static final Set<String> MISSING_MARKERS = Set.of("", "NaN", "nan", "NA", "N/A", "null", "NULL");

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][+-]?\\d+)?");

    private CellValues() {
        // Utility class
    }

    static Object infer(final String raw) {
        if (raw == null) {
            return null;
        }
        final var text = raw.trim();
        if (MISSING_MARKERS.contains(text)) {
            return null;
        }
        if (INTEGER.matcher(text).matches()) {
            try {
                return Long.parseLong(text);
            } catch (final NumberFormatException e) {
                // wider than a long, keep it as a decimal
                return Double.parseDouble(text);
            }
        }
        if (DECIMAL.matcher(text).matches()) {
            return Double.parseDouble(text);
        }
        return text;
    }
}
