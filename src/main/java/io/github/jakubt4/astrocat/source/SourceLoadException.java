package io.github.jakubt4.astrocat.source;

/**
 * A catalog source is missing, unreadable or not a well-formed delimited table.
 */
public class SourceLoadException extends RuntimeException {

    public SourceLoadException(final String source, final String detail) {
        super("Cannot load catalog source " + source + ": " + detail);
    }

    public SourceLoadException(final String source, final String detail, final Throwable cause) {
        super("Cannot load catalog source " + source + ": " + detail, cause);
    }
}
