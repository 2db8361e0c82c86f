package com.blogview.analytics.domain.filter;

import com.blogview.analytics.domain.exception.AnalyticsValidationException;

import java.util.Locale;

/**
 * Boolean combinator of a filter group.
 *
 * {@link #NOT} negates the AND of all children (n-ary NAND), it is not a unary negation.
 */
public enum Combinator {

    AND("and"),
    OR("or"),
    NOT("not");

    private final String code;

    Combinator(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Combinator fromCode(String code) {
        if (code != null) {
            for (Combinator combinator : values()) {
                if (combinator.code.equals(code.toLowerCase(Locale.ROOT))) {
                    return combinator;
                }
            }
        }
        throw new AnalyticsValidationException("Group operator must be one of and, or, not; got '" + code + "'.");
    }
}
