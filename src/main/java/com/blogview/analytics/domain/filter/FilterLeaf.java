package com.blogview.analytics.domain.filter;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;

import java.util.Map;
import java.util.TreeMap;

/**
 * Single field condition, e.g. {@code {"field": "country.code", "op": "eq", "value": "US"}}.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class FilterLeaf extends FilterExpression {

    private final String field;
    private final Operator operator;
    private final Object value;

    public FilterLeaf(@NonNull String field, @NonNull Operator operator, @NonNull Object value) {
        this.field = field;
        this.operator = operator;
        this.value = value;
    }

    @Override
    public Map<String, Object> toCanonicalMap() {
        Map<String, Object> canonical = new TreeMap<>();
        canonical.put("field", field);
        canonical.put("op", operator.getCode());
        canonical.put("value", value);
        return canonical;
    }

    @Override
    public int depth() {
        return 1;
    }

    @Override
    public String toString() {
        return field + " " + operator.getCode() + " " + value;
    }
}
