package io.github.jakubt4.astrocat.controller;

import io.github.jakubt4.astrocat.catalog.CatalogTable;
import io.github.jakubt4.astrocat.dto.CatalogSummary;
import io.github.jakubt4.astrocat.service.CatalogRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only access to the exported catalog tables by stable name.
 */
@Slf4j
@RestController
@RequestMapping("/api/catalogs")
@RequiredArgsConstructor
public class CatalogController {

    private final CatalogRegistry catalogRegistry;

    @GetMapping
    public List<CatalogSummary> listCatalogs() {
        return catalogRegistry.tables().stream()
                .map(CatalogSummary::of)
                .toList();
    }

    /**
     * Returns an exported table, optionally truncated to its first rows.
     *
     * @param name  stable export name
     * @param limit maximum number of rows to return; all rows when absent
     * @return {@code 200 OK} with the table, {@code 404 Not Found} for an unknown name,
     *         {@code 400 Bad Request} for a negative limit
     */
    @GetMapping("/{name}")
    public ResponseEntity<CatalogTable> getCatalog(@PathVariable final String name,
                                                   @RequestParam(required = false) final Integer limit) {
        if (limit != null && limit < 0) {
            return ResponseEntity.badRequest().build();
        }
        return catalogRegistry.find(name)
                .map(table -> limit == null ? table : table.head(limit))
                .map(ResponseEntity::ok)
                .orElseGet(() -> {
                    log.debug("Unknown catalog requested: [{}]", name);
                    return ResponseEntity.notFound().build();
                });
    }
}
