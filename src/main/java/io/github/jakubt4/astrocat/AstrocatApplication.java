package io.github.jakubt4.astrocat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Astrocat: analysis-ready Harris globular cluster and Gaia source catalogs.
 *
 * <p>At startup the three Harris catalog partitions and the Gaia source catalog are loaded,
 * their positions normalized to decimal degrees (sexagesimal, degree or radian input), the
 * Gaia rows augmented with a parallax-scaled cartesian position, and incomplete rows pruned.
 * The resulting immutable tables are served read-only by name.
 *
 * @see io.github.jakubt4.astrocat.service.CatalogRegistry
 * @see io.github.jakubt4.astrocat.service.CatalogNormalizer
 */
@SpringBootApplication
public class AstrocatApplication {

    public static void main(String[] args) {
        SpringApplication.run(AstrocatApplication.class, args);
    }
}
