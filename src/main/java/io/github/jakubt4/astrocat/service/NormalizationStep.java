package io.github.jakubt4.astrocat.service;

/**
 * Pipeline steps that can abort a catalog build, reported in {@link CatalogBuildException}.
 */
public enum NormalizationStep {
    LOAD,
    ALIGN_COLUMNS,
    NORMALIZE_ANGLES,
    SELECT_COLUMNS
}
