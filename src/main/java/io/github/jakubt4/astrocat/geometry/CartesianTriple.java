package io.github.jakubt4.astrocat.geometry;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Projection of (ra, dec, parallax) onto a sphere of radius {@code parallax}.
 * Serialized as a {@code [x, y, z]} array.
 */
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"x", "y", "z"})
public record CartesianTriple(double x, double y, double z) {

    public double norm() {
        return Math.sqrt(x * x + y * y + z * z);
    }
}
