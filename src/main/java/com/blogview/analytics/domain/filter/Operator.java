package com.blogview.analytics.domain.filter;

import com.blogview.analytics.domain.exception.AnalyticsValidationException;
import com.blogview.analytics.domain.exception.UnsupportedOperatorException;

import java.util.Locale;

/**
 * Whitelist of leaf operators accepted in filter expressions.
 *
 * Each constant carries its in-process semantics; the JPA lowering lives in
 * {@code CriteriaPredicateBuilder} and switches over the same constants.
 */
public enum Operator {

    EQ("eq"),
    NEQ("neq"),
    GT("gt"),
    GTE("gte"),
    LT("lt"),
    LTE("lte"),
    CONTAINS("contains"),
    STARTSWITH("startswith");

    private final String code;

    Operator(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Operator fromCode(String code) {
        if (code != null) {
            for (Operator operator : values()) {
                if (operator.code.equals(code.toLowerCase(Locale.ROOT))) {
                    return operator;
                }
            }
        }
        throw new UnsupportedOperatorException(code);
    }

    /**
     * Evaluate this operator against a row value.
     *
     * A missing row value only satisfies {@link #NEQ}.
     *
     * @param actual   value read from the row, may be null
     * @param expected filter value, already coerced to the row value's type
     */
    public boolean test(Object actual, Object expected) {
        if (actual == null) {
            return this == NEQ;
        }
        switch (this) {
            case EQ:
                return actual.equals(expected);
            case NEQ:
                return !actual.equals(expected);
            case CONTAINS:
                return text(actual).contains(text(expected));
            case STARTSWITH:
                return text(actual).startsWith(text(expected));
            default:
                if (!(actual instanceof Comparable)) {
                    throw new AnalyticsValidationException("Operator '" + code + "' requires an ordered field.");
                }
                int cmp = ((Comparable) actual).compareTo(expected);
                switch (this) {
                    case GT:
                        return cmp > 0;
                    case GTE:
                        return cmp >= 0;
                    case LT:
                        return cmp < 0;
                    default:
                        return cmp <= 0;
                }
        }
    }

    private String text(Object value) {
        if (!(value instanceof String)) {
            throw new AnalyticsValidationException("Operator '" + code + "' requires a text field.");
        }
        return ((String) value).toLowerCase(Locale.ROOT);
    }
}
