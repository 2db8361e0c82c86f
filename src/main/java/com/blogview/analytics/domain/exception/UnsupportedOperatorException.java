package com.blogview.analytics.domain.exception;

import lombok.Getter;

@Getter
public class UnsupportedOperatorException extends AnalyticsValidationException {

    private final String operator;

    public UnsupportedOperatorException(String operator) {
        super("Operator '" + operator + "' is not supported.");
        this.operator = operator;
    }
}
