package com.ammann.analytics.exception;

/**
 * Base unchecked exception for all errors raised by the analytics kernel.
 *
 * <p>Subclasses represent specific error categories (invalid input or
 * configuration, exceeded computation deadlines). Routine sparse input never
 * raises an exception; engines return neutral results instead.
 */
public class AnalyticsException extends RuntimeException {
    public AnalyticsException(String message, Throwable cause) {
        super(message, cause);
    }
    public AnalyticsException(String message) {
        super(message);
    }

    public AnalyticsException(Throwable cause) {
        super(cause);
    }
}
