package io.github.jakubt4.astrocat.geometry;

import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;

/**
 * Spherical to cartesian projection of catalog positions, scaled by parallax:
 * <pre>
 *   x = parallax * cos(dec) * cos(ra)
 *   y = parallax * cos(dec) * sin(ra)
 *   z = parallax * sin(dec)
 * </pre>
 * Inputs are decimal degrees and are converted to radians before the trigonometry.
 * Parallax is not validated; zero or negative values simply scale the result.
 */
public final class GeometricProjector {

    private GeometricProjector() {
        // Utility class
    }

    public static CartesianTriple project(final double raDegrees, final double decDegrees, final double parallax) {
        // Vector3D(alpha, delta) is the unit vector at azimuth alpha, elevation delta
        final var direction = new Vector3D(FastMath.toRadians(raDegrees), FastMath.toRadians(decDegrees));
        final var position = direction.scalarMultiply(parallax);
        return new CartesianTriple(position.getX(), position.getY(), position.getZ());
    }
}
