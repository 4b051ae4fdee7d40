package io.github.jakubt4.astrocat.service;

import io.github.jakubt4.astrocat.angle.AngleInput;
import io.github.jakubt4.astrocat.angle.AngleParseException;
import io.github.jakubt4.astrocat.angle.AngleParser;
import io.github.jakubt4.astrocat.catalog.CatalogDefinition;
import io.github.jakubt4.astrocat.catalog.CatalogRow;
import io.github.jakubt4.astrocat.catalog.CatalogTable;
import io.github.jakubt4.astrocat.geometry.CartesianTriple;
import io.github.jakubt4.astrocat.geometry.GeometricProjector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

import static io.github.jakubt4.astrocat.catalog.CatalogDefinitions.CARTESIAN;
import static io.github.jakubt4.astrocat.catalog.CatalogDefinitions.DEC;
import static io.github.jakubt4.astrocat.catalog.CatalogDefinitions.PARALLAX;
import static io.github.jakubt4.astrocat.catalog.CatalogDefinitions.RA;

/**
 * Turns a raw catalog into its exported form, following a {@link CatalogDefinition}:
 * <ol>
 *   <li>rename columns to their canonical names</li>
 *   <li>convert {@code ra}/{@code dec} to decimal degrees</li>
 *   <li>add the parallax-scaled {@code cartesian} position</li>
 *   <li>drop rows with missing required values</li>
 *   <li>keep only the exported columns</li>
 * </ol>
 *
 * <p>Rows whose angles cannot be parsed are dropped with a warning, unless
 * {@code astrocat.catalog.strict-angles} is set, in which case the build fails.
 * Schema problems (a required or exported column absent from the source) always fail the build.
 */
@Slf4j
@Service
public class CatalogNormalizer {

    private final boolean strictAngles;

    public CatalogNormalizer(@Value("${astrocat.catalog.strict-angles:false}") final boolean strictAngles) {
        this.strictAngles = strictAngles;
    }

    /**
     * @throws CatalogBuildException if the source schema does not fit the definition, or on an
     *                               unparseable angle in strict mode
     */
    public CatalogTable normalize(final CatalogDefinition definition, final CatalogTable raw) {
        final var header = raw.columns().stream()
                .map(column -> definition.columnRenames().getOrDefault(column, column))
                .toList();
        checkSchema(definition, header);

        final var exported = exportedColumns(definition, header);
        final List<CatalogRow> rows = new ArrayList<>(raw.size());
        var unparseable = 0;
        var incomplete = 0;

        for (var index = 0; index < raw.size(); index++) {
            final var rowNumber = index + 1;
            final var values = renamed(definition, raw.rows().get(index));
            try {
                if (definition.hasAngles()) {
                    values.put(RA, toDegrees(definition, RA, values.get(RA), AngleParser::rightAscension));
                    values.put(DEC, toDegrees(definition, DEC, values.get(DEC), AngleParser::declination));
                }
                if (definition.projectCartesian()) {
                    values.put(CARTESIAN, project(values));
                }
                requirePresent(definition, values);
                rows.add(new CatalogRow(select(values, exported)));
            } catch (final MissingValueException e) {
                incomplete++;
                log.debug("[{}] Dropping row {}: missing '{}'", definition.name(), rowNumber, e.getColumn());
            } catch (final AngleParseException e) {
                if (strictAngles) {
                    throw new CatalogBuildException(definition, NormalizationStep.NORMALIZE_ANGLES,
                            "row " + rowNumber + ": " + e.getMessage(), e);
                }
                unparseable++;
                log.warn("[{}] Dropping row {} with unparseable angle: {}", definition.name(), rowNumber, e.getMessage());
            }
        }

        log.info("[{}] Normalized {} rows: {} exported, {} dropped for missing values, {} for unparseable angles",
                definition.name(), raw.size(), rows.size(), incomplete, unparseable);
        return new CatalogTable(definition.name(), exported, rows);
    }

    private static void checkSchema(final CatalogDefinition definition, final List<String> header) {
        final List<String> needed = new ArrayList<>(definition.requiredColumns());
        if (definition.hasAngles()) {
            needed.addAll(List.of(RA, DEC));
        }
        if (definition.projectCartesian()) {
            needed.addAll(List.of(RA, DEC, PARALLAX));
        }
        for (final var column : needed) {
            if (!header.contains(column)) {
                throw new CatalogBuildException(definition, NormalizationStep.ALIGN_COLUMNS,
                        "column '" + column + "' not found in " + header);
            }
        }
        for (final var column : definition.exportColumns()) {
            final var derived = definition.projectCartesian() && CARTESIAN.equals(column);
            if (!derived && !header.contains(column)) {
                throw new CatalogBuildException(definition, NormalizationStep.SELECT_COLUMNS,
                        "exported column '" + column + "' not found in " + header);
            }
        }
    }

    private static List<String> exportedColumns(final CatalogDefinition definition, final List<String> header) {
        if (!definition.exportColumns().isEmpty()) {
            return definition.exportColumns();
        }
        final List<String> columns = new ArrayList<>(header);
        if (definition.projectCartesian()) {
            columns.add(CARTESIAN);
        }
        return columns;
    }

    private static Map<String, Object> renamed(final CatalogDefinition definition, final CatalogRow row) {
        final Map<String, Object> values = new LinkedHashMap<>();
        row.values().forEach((column, value) ->
                values.put(definition.columnRenames().getOrDefault(column, column), value));
        return values;
    }

    private static Double toDegrees(final CatalogDefinition definition, final String column, final Object cell,
                                    final ToDoubleFunction<AngleInput> conversion) {
        try {
            final var input = definition.angleFormat().toInput(cell);
            return input == null ? null : conversion.applyAsDouble(input);
        } catch (final AngleParseException e) {
            throw new AngleParseException("column '" + column + "': " + e.getMessage(), e);
        }
    }

    private static CartesianTriple project(final Map<String, Object> values) {
        if (values.get(RA) instanceof Number ra
                && values.get(DEC) instanceof Number dec
                && values.get(PARALLAX) instanceof Number parallax) {
            return GeometricProjector.project(ra.doubleValue(), dec.doubleValue(), parallax.doubleValue());
        }
        return null;
    }

    private static void requirePresent(final CatalogDefinition definition, final Map<String, Object> values) {
        final var columns = definition.requireAllColumns() ? values.keySet() : definition.requiredColumns();
        for (final var column : columns) {
            if (values.get(column) == null) {
                throw new MissingValueException(column);
            }
        }
    }

    private static Map<String, Object> select(final Map<String, Object> values, final List<String> columns) {
        final Map<String, Object> selected = new LinkedHashMap<>();
        for (final var column : columns) {
            selected.put(column, values.get(column));
        }
        return selected;
    }
}
