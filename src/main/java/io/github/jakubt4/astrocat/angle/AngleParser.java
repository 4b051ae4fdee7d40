package io.github.jakubt4.astrocat.angle;

import org.hipparchus.util.FastMath;
import org.hipparchus.util.Precision;

import java.util.regex.Pattern;

/**
 * Converts right ascension and declination values to decimal degrees rounded to
 * {@value #DECIMAL_PLACES} places.
 *
 * <p>Sexagesimal text must split on whitespace into exactly three tokens:
 * <ul>
 *   <li>right ascension {@code "H M S"}: {@code (H + M/60 + S/3600) * 15}, e.g.
 *       {@code "05 34 31.94"} → {@code 83.6331}</li>
 *   <li>declination {@code "D M S"}: the sign lives on the degrees token only and applies to
 *       the whole angle, e.g. {@code "-22 00 52.2"} → {@code -22.0145}</li>
 * </ul>
 * Values already in decimal degrees are only rounded; radian values are converted first.
 */
public final class AngleParser {

    public static final int DECIMAL_PLACES = 4;

    private static final double DEGREES_PER_HOUR = 15.0; // 360 deg / 24 h
    private static final Pattern UNSIGNED = Pattern.compile("\\d+(\\.\\d*)?|\\.\\d+");
    private static final Pattern SIGNED = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)");

    private AngleParser() {
        // Utility class
    }

    /**
     * @throws AngleParseException if the input is absent or malformed
     */
    public static double rightAscension(final AngleInput input) {
        if (input instanceof AngleInput.Sexagesimal sexagesimal) {
            final var text = sexagesimal.text();
            final var tokens = tokenize(text);
            final var hours = parse(tokens[0], UNSIGNED, "hours", text);
            final var minutes = sixtieths(tokens[1], "minutes", text);
            final var seconds = sixtieths(tokens[2], "seconds", text);
            return finite(round((hours + minutes / 60.0 + seconds / 3600.0) * DEGREES_PER_HOUR), text);
        }
        return resolved(input, "right ascension");
    }

    /**
     * @throws AngleParseException if the input is absent or malformed
     */
    public static double declination(final AngleInput input) {
        if (input instanceof AngleInput.Sexagesimal sexagesimal) {
            final var text = sexagesimal.text();
            final var tokens = tokenize(text);
            // read the sign from the text so "-00 30 00" stays negative
            final var negative = tokens[0].startsWith("-");
            final var degrees = Math.abs(parse(tokens[0], SIGNED, "degrees", text));
            final var arcMinutes = sixtieths(tokens[1], "arc-minutes", text);
            final var arcSeconds = sixtieths(tokens[2], "arc-seconds", text);
            final var magnitude = degrees + arcMinutes / 60.0 + arcSeconds / 3600.0;
            return finite(round(negative ? -magnitude : magnitude), text);
        }
        return resolved(input, "declination");
    }

    public static double round(final double degrees) {
        // + 0.0 turns a rounded -0.0 into 0.0
        return Precision.round(degrees, DECIMAL_PLACES) + 0.0;
    }

    private static double resolved(final AngleInput input, final String quantity) {
        final double degrees;
        if (input instanceof AngleInput.DecimalDegrees decimal) {
            degrees = decimal.degrees();
        } else if (input instanceof AngleInput.Radians radians) {
            degrees = FastMath.toDegrees(radians.radians());
        } else {
            throw new AngleParseException("Missing " + quantity + " value");
        }
        if (!Double.isFinite(degrees)) {
            throw new AngleParseException("Non-finite " + quantity + " value: " + degrees);
        }
        return round(degrees);
    }

    private static double finite(final double degrees, final String text) {
        if (!Double.isFinite(degrees)) {
            throw new AngleParseException("Non-finite angle '" + text + "'");
        }
        return degrees;
    }

    private static String[] tokenize(final String text) {
        if (text == null || text.isBlank()) {
            throw new AngleParseException("Blank sexagesimal angle");
        }
        final var tokens = text.trim().split("\\s+");
        if (tokens.length != 3) {
            throw new AngleParseException("Expected 3 sexagesimal tokens, got " + tokens.length + " in '" + text + "'");
        }
        return tokens;
    }

    private static double sixtieths(final String token, final String field, final String text) {
        final var value = parse(token, UNSIGNED, field, text);
        if (value >= 60.0) {
            throw new AngleParseException("Out of range " + field + " '" + token + "' in '" + text + "'");
        }
        return value;
    }

    private static double parse(final String token, final Pattern format, final String field, final String text) {
        if (!format.matcher(token).matches()) {
            throw new AngleParseException("Invalid " + field + " token '" + token + "' in '" + text + "'");
        }
        final var value = Double.parseDouble(token);
        if (!Double.isFinite(value)) {
            throw new AngleParseException("Non-finite " + field + " token '" + token + "' in '" + text + "'");
        }
        return value;
    }
}
