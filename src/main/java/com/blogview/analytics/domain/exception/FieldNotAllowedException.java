package com.blogview.analytics.domain.exception;

import lombok.Getter;

/**
 * A filter condition referenced a field outside the allow-list.
 */
@Getter
public class FieldNotAllowedException extends AnalyticsValidationException {

    private final String field;

    public FieldNotAllowedException(String field) {
        super("Filtering by field '" + field + "' is not allowed.");
        this.field = field;
    }
}
