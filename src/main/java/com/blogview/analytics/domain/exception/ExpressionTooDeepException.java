package com.blogview.analytics.domain.exception;

/**
 * Filter expression nested deeper than the configured limit.
 */
public class ExpressionTooDeepException extends AnalyticsValidationException {

    public ExpressionTooDeepException(int maxDepth) {
        super("Filter expression exceeds the maximum nesting depth of " + maxDepth + ".");
    }
}
