package com.ammann.randomness.exception;

/**
 * Base unchecked exception for all application-level errors raised by the randomness service.
 *
 * <p>Subclasses represent specific error categories (invalid arguments, cache not ready) and
 * are mapped to HTTP status codes by {@link GlobalExceptionHandler}.
 */
public class ApiException extends RuntimeException
{
    public ApiException(String message, Throwable cause) {
        super(message, cause);
    }

    public ApiException(String message) {
        super(message);
    }
}
