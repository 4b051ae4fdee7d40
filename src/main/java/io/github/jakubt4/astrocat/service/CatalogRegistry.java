package io.github.jakubt4.astrocat.service;

import io.github.jakubt4.astrocat.catalog.CatalogTable;
import io.github.jakubt4.astrocat.config.CatalogSources;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Holds the exported catalog tables by stable name.
 *
 * <p>All catalogs are built once, in sequence, during startup. A {@link CatalogBuildException}
 * escapes {@link #init()} and aborts the application context, so a running application always
 * holds every configured catalog. Tables are immutable and safe to read from any thread.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CatalogRegistry {

    private final CatalogSources catalogSources;
    private final CatalogFactory catalogFactory;

    private Map<String, CatalogTable> tables = Map.of();

    @PostConstruct
    void init() {
        final Map<String, CatalogTable> built = new LinkedHashMap<>();
        for (final var definition : catalogSources.definitions()) {
            built.put(definition.name(), catalogFactory.build(definition));
        }
        tables = Collections.unmodifiableMap(built);
        log.info("Catalogs ready: {}", tables.keySet());
    }

    public Optional<CatalogTable> find(final String name) {
        return Optional.ofNullable(tables.get(name));
    }

    /**
     * @return every exported table, in build order
     */
    public List<CatalogTable> tables() {
        return List.copyOf(tables.values());
    }
}
