package io.github.jakubt4.astrocat.angle;

/**
 * How a catalog stores its angular columns. Chosen per source, never inferred from a value.
 */
public enum AngleFormat {

    /** Text {@code "H M S"} / {@code "D M S"}; cells that already loaded as numbers are decimal degrees. */
    SEXAGESIMAL,

    DEGREES,

    RADIANS;

    /**
     * Tags a loaded cell value with its representation.
     *
     * @param cell a {@link String} or {@link Number} produced by the catalog reader
     * @return the tagged input, or {@code null} when the cell is missing
     * @throws AngleParseException if the cell type does not match this format
     */
    public AngleInput toInput(final Object cell) {
        if (cell == null) {
            return null;
        }
        if (cell instanceof Number number) {
            return this == RADIANS
                    ? new AngleInput.Radians(number.doubleValue())
                    : new AngleInput.DecimalDegrees(number.doubleValue());
        }
        if (this == SEXAGESIMAL) {
            return new AngleInput.Sexagesimal(cell.toString());
        }
        throw new AngleParseException("Expected numeric " + name().toLowerCase() + " value, got '" + cell + "'");
    }
}
