package com.blogview.analytics.domain.exception;

/**
 * Rejected analytics request: malformed filter payload, unknown literal or bad date.
 *
 * Surfaced to the caller as a 400 and never retried.
 */
public class AnalyticsValidationException extends RuntimeException {

    public AnalyticsValidationException(String message) {
        super(message);
    }

    public AnalyticsValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
