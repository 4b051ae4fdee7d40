package io.github.jakubt4.astrocat.angle;

/**
 * Raised when an angle value cannot be converted to decimal degrees.
 * The parser never recovers from it; the caller decides whether the row is dropped.
 */
public class AngleParseException extends RuntimeException {

    public AngleParseException(final String message) {
        super(message);
    }

    public AngleParseException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
