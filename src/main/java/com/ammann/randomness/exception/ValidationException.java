package com.ammann.randomness.exception;

/**
 * A client-supplied argument is outside the accepted domain: a {@code count} beyond a
 * cache's bounds, or a source selection that names no known source.
 *
 * <p>Mapped to HTTP 400 (Bad Request) by {@link GlobalExceptionHandler}. Raised before any
 * generation is built or read.
 */
public class ValidationException extends ApiException {

    public ValidationException(String message) {
        super(message);
    }

    /**
     * Creates validation exception for a count outside {@code [min, max]}.
     */
    public static ValidationException countOutOfRange(String target, int count, int min, int max) {
        return new ValidationException(
                String.format("Invalid count for %s: got %d, expected a value between %d and %d",
                        target, count, min, max));
    }

    /**
     * Creates validation exception for invalid parameter.
     */
    public static ValidationException invalidParameter(String paramName, Object value, String expected) {
        return new ValidationException(
                String.format("Invalid parameter '%s': got '%s', expected %s",
                        paramName, value, expected));
    }
}
