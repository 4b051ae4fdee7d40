package io.github.jakubt4.astrocat.catalog;

import io.github.jakubt4.astrocat.angle.AngleFormat;
import org.springframework.core.io.Resource;

import java.util.List;
import java.util.Map;

/**
 * Stock definitions for the three Harris globular cluster catalog partitions and the
 * Gaia source catalog.
 */
public final class CatalogDefinitions {

    public static final String HARRIS_IDENT_POS = "harris_ident_pos";
    public static final String HARRIS_METALLICITY_PHOTOMETRY = "harris_metallicity_photometry";
    public static final String HARRIS_VELOCITY_STRUCT_PARAMS = "harris_velocity_struct_params";
    public static final String GAIA = "gaia";

    public static final String RA = "ra";
    public static final String DEC = "dec";
    public static final String PARALLAX = "parallax";
    public static final String CARTESIAN = "cartesian";

    static final String HARRIS_RA = "RA (2000)";
    static final String HARRIS_DEC = "DEC";

    public static final List<String> GAIA_EXPORT_COLUMNS =
            List.of("solution_id", "designation", RA, DEC, PARALLAX, CARTESIAN);

    private CatalogDefinitions() {
        // Utility class
    }

    /**
     * Harris part 1: identifiers and sexagesimal J2000 positions, renamed to the Gaia column names.
     */
    public static CatalogDefinition harrisIdentityPosition(final Resource location) {
        return CatalogDefinition.builder()
                .name(HARRIS_IDENT_POS)
                .location(location)
                .columnRenames(Map.of(HARRIS_RA, RA, HARRIS_DEC, DEC))
                .angleFormat(AngleFormat.SEXAGESIMAL)
                .requiredColumns(List.of(RA, DEC))
                .build();
    }

    /**
     * Harris part 2: metallicity and photometry, passed through.
     */
    public static CatalogDefinition harrisMetallicityPhotometry(final Resource location) {
        return passThrough(HARRIS_METALLICITY_PHOTOMETRY, location);
    }

    /**
     * Harris part 3: velocities and structural parameters, passed through.
     */
    public static CatalogDefinition harrisVelocityStructure(final Resource location) {
        return passThrough(HARRIS_VELOCITY_STRUCT_PARAMS, location);
    }

    /**
     * Gaia source catalog, augmented with a parallax-scaled cartesian position and
     * restricted to {@link #GAIA_EXPORT_COLUMNS}.
     *
     * @param angleFormat how the archive export stores ra/dec, normally {@link AngleFormat#DEGREES}
     */
    public static CatalogDefinition gaia(final Resource location, final AngleFormat angleFormat) {
        return CatalogDefinition.builder()
                .name(GAIA)
                .location(location)
                .angleFormat(angleFormat)
                .projectCartesian(true)
                .requiredColumns(List.of(RA, DEC))
                .exportColumns(GAIA_EXPORT_COLUMNS)
                .build();
    }

    private static CatalogDefinition passThrough(final String name, final Resource location) {
        return CatalogDefinition.builder()
                .name(name)
                .location(location)
                .requireAllColumns(true)
                .build();
    }
}
