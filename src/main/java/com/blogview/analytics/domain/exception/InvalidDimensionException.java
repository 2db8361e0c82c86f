package com.blogview.analytics.domain.exception;

/**
 * A grouping dimension was requested that the query source cannot group by.
 *
 * This is a contract violation inside the service, not a user input error,
 * so it is reported as a server error.
 */
public class InvalidDimensionException extends IllegalStateException {

    public InvalidDimensionException(String message) {
        super(message);
    }
}
