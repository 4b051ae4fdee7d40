package io.github.jakubt4.astrocat.config;

import io.github.jakubt4.astrocat.angle.AngleFormat;
import io.github.jakubt4.astrocat.catalog.CatalogDefinitions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

import java.util.List;

/**
 * Binds the raw catalog file locations. Locations accept any Spring resource prefix
 * ({@code file:}, {@code classpath:}); defaults point at {@code ./data} relative to the working directory.
 */
@Slf4j
@Configuration
public class CatalogSourceConfig {

    @Bean
    CatalogSources catalogSources(
            @Value("${astrocat.catalog.harris-ident-pos:file:./data/harris_pt1.csv}") final Resource harrisIdentPos,
            @Value("${astrocat.catalog.harris-metallicity-photometry:file:./data/harris_pt2.csv}")
            final Resource harrisMetallicityPhotometry,
            @Value("${astrocat.catalog.harris-velocity-struct-params:file:./data/harris_pt3.csv}")
            final Resource harrisVelocityStructParams,
            @Value("${astrocat.catalog.gaia:file:./data/GaiaSource.csv}") final Resource gaia,
            @Value("${astrocat.catalog.gaia-angle-format:DEGREES}") final AngleFormat gaiaAngleFormat) {
        log.info("Catalog sources configured, Gaia angles stored as {}", gaiaAngleFormat);
        return new CatalogSources(List.of(
                CatalogDefinitions.harrisIdentityPosition(harrisIdentPos),
                CatalogDefinitions.harrisMetallicityPhotometry(harrisMetallicityPhotometry),
                CatalogDefinitions.harrisVelocityStructure(harrisVelocityStructParams),
                CatalogDefinitions.gaia(gaia, gaiaAngleFormat)
        ));
    }
}
