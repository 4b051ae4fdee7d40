package io.github.jakubt4.astrocat.dto;

import io.github.jakubt4.astrocat.catalog.CatalogTable;

import java.util.List;

/**
 * Listing entry for an exported catalog.
 *
 * @param name     stable export name (e.g. {@code "gaia"})
 * @param columns  exported columns, in order
 * @param rowCount rows that survived normalization
 */
public record CatalogSummary(String name, List<String> columns, int rowCount) {

    public static CatalogSummary of(final CatalogTable table) {
        return new CatalogSummary(table.name(), table.columns(), table.size());
    }
}
