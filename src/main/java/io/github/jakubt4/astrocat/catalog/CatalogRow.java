package io.github.jakubt4.astrocat.catalog;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One catalog record: column name to scalar value, in column order.
 * A {@code null} value is a missing cell. Instances are immutable and own their storage.
 */
public record CatalogRow(@JsonValue Map<String, Object> values) {

    public CatalogRow {
        // Map.copyOf rejects nulls, and missing cells are nulls
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Object get(final String column) {
        return values.get(column);
    }

    public boolean isMissing(final String column) {
        return values.get(column) == null;
    }

    public Set<String> columns() {
        return values.keySet();
    }
}
