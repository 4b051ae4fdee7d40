package io.github.jakubt4.astrocat.angle;

/**
 * A raw right ascension or declination value, tagged with its representation
 * when the catalog cell is loaded.
 *
 * @see AngleFormat#toInput(Object)
 * @see AngleParser
 */
public sealed interface AngleInput permits AngleInput.Sexagesimal, AngleInput.DecimalDegrees, AngleInput.Radians {

    /**
     * @param text {@code "H M S"} for right ascension or {@code "D M S"} for declination
     */
    record Sexagesimal(String text) implements AngleInput {}

    record DecimalDegrees(double degrees) implements AngleInput {}

    record Radians(double radians) implements AngleInput {}
}
