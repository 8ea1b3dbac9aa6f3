package com.ammann.randomness.exception;

/**
 * No generation has been published and one could not be built for the current request.
 *
 * <p>Only possible before the first successful refresh. Mapped to HTTP 503
 * (Service Unavailable) by {@link GlobalExceptionHandler}.
 */
public class NotReadyException extends ApiException
{
    public NotReadyException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
