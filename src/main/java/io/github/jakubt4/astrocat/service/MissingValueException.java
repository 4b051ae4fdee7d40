package io.github.jakubt4.astrocat.service;

import lombok.Getter;

/**
 * A required cell is absent after conversion. Never leaves {@link CatalogNormalizer}: the row is dropped.
 */
@Getter
class MissingValueException extends RuntimeException {

    private final String column;

    MissingValueException(final String column) {
        super("Missing required value in column '" + column + "'");
        this.column = column;
    }
}
