package io.github.jakubt4.astrocat.service;

import io.github.jakubt4.astrocat.catalog.CatalogDefinition;
import io.github.jakubt4.astrocat.catalog.CatalogTable;
import io.github.jakubt4.astrocat.source.CatalogFileReader;
import io.github.jakubt4.astrocat.source.SourceLoadException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Builds one exported catalog from its definition: load the raw file, then normalize it.
 * Every call returns a freshly built table that shares nothing with other tables.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CatalogFactory {

    private final CatalogFileReader catalogFileReader;
    private final CatalogNormalizer catalogNormalizer;

    /**
     * @throws CatalogBuildException if the source cannot be loaded or does not fit the definition
     */
    public CatalogTable build(final CatalogDefinition definition) {
        log.info("[{}] Loading {}", definition.name(), definition.location().getDescription());

        final CatalogTable raw;
        try {
            raw = catalogFileReader.read(definition.location());
        } catch (final SourceLoadException e) {
            throw new CatalogBuildException(definition, NormalizationStep.LOAD, e.getMessage(), e);
        }
        return catalogNormalizer.normalize(definition, raw);
    }
}
