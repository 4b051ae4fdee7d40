package io.github.jakubt4.astrocat.source;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import io.github.jakubt4.astrocat.catalog.CatalogRow;
import io.github.jakubt4.astrocat.catalog.CatalogTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a comma-separated catalog file with a header row into a raw {@link CatalogTable}.
 *
 * <p>Cells are typed by {@link CellValues}. Repeated header names get a {@code .1}, {@code .2}, ...
 * suffix so every column stays addressable; blank header names become {@code Unnamed: <index>}.
 * Short records are padded with missing values.
 */
@Slf4j
@Component
public class CatalogFileReader {

    private static final CsvMapper CSV_MAPPER = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvParser.Feature.TRIM_SPACES)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();

    /**
     * @throws SourceLoadException if the file is missing, unreadable, empty, or has a record
     *                             wider than its header
     */
    public CatalogTable read(final Resource location) {
        final var source = location.getDescription();
        if (!location.exists()) {
            throw new SourceLoadException(source, "file not found");
        }

        try (var in = location.getInputStream();
             MappingIterator<String[]> records = CSV_MAPPER.readerFor(String[].class).readValues(in)) {
            if (!records.hasNext()) {
                throw new SourceLoadException(source, "no header row");
            }
            final var header = uniqueHeader(records.next());

            final List<CatalogRow> rows = new ArrayList<>();
            while (records.hasNext()) {
                final var cells = records.next();
                if (cells.length > header.size()) {
                    throw new SourceLoadException(source, "record " + (rows.size() + 1) + " has "
                            + cells.length + " fields, header has " + header.size());
                }
                final Map<String, Object> values = new LinkedHashMap<>();
                for (var i = 0; i < header.size(); i++) {
                    values.put(header.get(i), i < cells.length ? CellValues.infer(cells[i]) : null);
                }
                rows.add(new CatalogRow(values));
            }

            log.debug("Read {} rows x {} columns from {}", rows.size(), header.size(), source);
            return new CatalogTable(source, header, rows);
        } catch (final IOException | RuntimeJsonMappingException e) {
            throw new SourceLoadException(source, e.getMessage(), e);
        }
    }

    static List<String> uniqueHeader(final String[] raw) {
        final List<String> header = new ArrayList<>(raw.length);
        final Map<String, Integer> seen = new HashMap<>();
        for (var i = 0; i < raw.length; i++) {
            final var name = raw[i] == null || raw[i].isBlank() ? "Unnamed: " + i : raw[i].trim();
            final int occurrences = seen.merge(name, 1, Integer::sum);
            header.add(occurrences == 1 ? name : name + "." + (occurrences - 1));
        }
        return header;
    }
}
