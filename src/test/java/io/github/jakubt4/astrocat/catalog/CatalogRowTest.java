package io.github.jakubt4.astrocat.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CatalogRowTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void serializesAsPlainObjectInColumnOrderWithMissingCellsAsNull() throws Exception {
        final Map<String, Object> values = new LinkedHashMap<>();
        values.put("ID", "NGC 104");
        values.put("ra", 6.0236);
        values.put("Name", null);

        final var json = objectMapper.writeValueAsString(new CatalogRow(values));

        assertThat(json).isEqualTo("{\"ID\":\"NGC 104\",\"ra\":6.0236,\"Name\":null}");
    }

    @Test
    void ownsItsStorage() {
        final Map<String, Object> values = new LinkedHashMap<>();
        values.put("ra", 6.0236);
        final var row = new CatalogRow(values);

        values.put("ra", 0.0);

        assertThat(row.get("ra")).isEqualTo(6.0236);
        assertThatThrownBy(() -> row.values().put("dec", 1.0)).isInstanceOf(UnsupportedOperationException.class);
    }
}
