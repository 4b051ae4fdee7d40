package io.github.jakubt4.astrocat.service;

import io.github.jakubt4.astrocat.catalog.CatalogDefinition;
import lombok.Getter;

/**
 * A catalog could not be built. Fatal to startup: no table is exported for the catalog.
 * The message names the catalog, its source file and the failing step.
 */
@Getter
public class CatalogBuildException extends RuntimeException {

    private final String catalog;
    private final NormalizationStep step;

    public CatalogBuildException(final CatalogDefinition definition, final NormalizationStep step,
                                 final String detail) {
        this(definition, step, detail, null);
    }

    public CatalogBuildException(final CatalogDefinition definition, final NormalizationStep step,
                                 final String detail, final Throwable cause) {
        super("Failed to build catalog [%s] from %s at step %s: %s".formatted(
                definition.name(), definition.location().getDescription(), step, detail), cause);
        this.catalog = definition.name();
        this.step = step;
    }
}
