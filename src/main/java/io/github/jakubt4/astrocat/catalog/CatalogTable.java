package io.github.jakubt4.astrocat.catalog;

import java.util.List;

/**
 * An ordered, fixed-schema sequence of {@link CatalogRow}s.
 *
 * @param name    stable export name, or the source location for raw tables
 * @param columns column names in order; every row carries exactly these keys
 * @param rows    rows in source order
 */
public record CatalogTable(String name, List<String> columns, List<CatalogRow> rows) {

    public CatalogTable {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }

    public int size() {
        return rows.size();
    }

    /**
     * @return a table holding at most the first {@code limit} rows
     */
    public CatalogTable head(final int limit) {
        if (limit >= rows.size()) {
            return this;
        }
        return new CatalogTable(name, columns, rows.subList(0, limit));
    }
}
