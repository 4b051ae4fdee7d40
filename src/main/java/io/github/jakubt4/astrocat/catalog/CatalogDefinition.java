package io.github.jakubt4.astrocat.catalog;

import io.github.jakubt4.astrocat.angle.AngleFormat;
import lombok.Builder;
import org.springframework.core.io.Resource;

import java.util.List;
import java.util.Map;

/**
 * Describes how one raw source becomes an exported table.
 *
 * @param name              stable export name
 * @param location          raw delimited file with a header row
 * @param columnRenames     raw header name to canonical name, applied before anything else
 * @param angleFormat       representation of the {@code ra}/{@code dec} columns; {@code null} when
 *                          the source has no angular columns
 * @param projectCartesian  whether to add a {@code cartesian} column from ra, dec and parallax
 * @param requireAllColumns drop rows with a missing value in any column, not only in {@code requiredColumns}
 * @param requiredColumns   rows missing any of these are dropped
 * @param exportColumns     columns kept in the exported table, in order; empty keeps all
 */
@Builder
public record CatalogDefinition(
        String name,
        Resource location,
        Map<String, String> columnRenames,
        AngleFormat angleFormat,
        boolean projectCartesian,
        boolean requireAllColumns,
        List<String> requiredColumns,
        List<String> exportColumns) {

    public CatalogDefinition {
        columnRenames = columnRenames == null ? Map.of() : Map.copyOf(columnRenames);
        requiredColumns = requiredColumns == null ? List.of() : List.copyOf(requiredColumns);
        exportColumns = exportColumns == null ? List.of() : List.copyOf(exportColumns);
    }

    public boolean hasAngles() {
        return angleFormat != null;
    }
}
