package com.blogview.analytics.domain.filter;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Ordered list of child expressions joined by a {@link Combinator}.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class FilterGroup extends FilterExpression {

    private final Combinator combinator;
    private final List<FilterExpression> children;

    public FilterGroup(@NonNull Combinator combinator, @NonNull List<FilterExpression> children) {
        this.combinator = combinator;
        this.children = List.copyOf(children);
    }

    public static FilterGroup of(Combinator combinator, FilterExpression... children) {
        return new FilterGroup(combinator, List.of(children));
    }

    @Override
    public Map<String, Object> toCanonicalMap() {
        List<Map<String, Object>> conditions = new ArrayList<>();
        for (FilterExpression child : children) {
            conditions.add(child.toCanonicalMap());
        }
        // and, or and nand are commutative
        conditions.sort(Comparator.comparing(FilterGroup::sortKey));

        Map<String, Object> canonical = new TreeMap<>();
        canonical.put("conditions", conditions);
        canonical.put("operator", combinator.getCode());
        return canonical;
    }

    /**
     * Renders a canonical child with the type of every scalar, so {@code 1} and {@code "1"}
     * never tie and the order does not depend on the input order.
     */
    private static String sortKey(Object canonical) {
        if (canonical instanceof Map) {
            StringBuilder key = new StringBuilder("{");
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) canonical).entrySet()) {
                key.append(entry.getKey()).append('=').append(sortKey(entry.getValue())).append(',');
            }
            return key.append('}').toString();
        }
        if (canonical instanceof List) {
            StringBuilder key = new StringBuilder("[");
            for (Object element : (List<?>) canonical) {
                key.append(sortKey(element)).append(',');
            }
            return key.append(']').toString();
        }
        return canonical.getClass().getSimpleName() + ':' + canonical;
    }

    @Override
    public int depth() {
        int deepest = 0;
        for (FilterExpression child : children) {
            deepest = Math.max(deepest, child.depth());
        }
        return deepest + 1;
    }

    @Override
    public String toString() {
        return combinator.getCode() + children;
    }
}
