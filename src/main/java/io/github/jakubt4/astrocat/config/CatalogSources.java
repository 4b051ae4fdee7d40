package io.github.jakubt4.astrocat.config;

import io.github.jakubt4.astrocat.catalog.CatalogDefinition;

import java.util.List;

/**
 * The catalogs to build at startup, in build order.
 */
public record CatalogSources(List<CatalogDefinition> definitions) {

    public CatalogSources {
        definitions = List.copyOf(definitions);
    }
}
