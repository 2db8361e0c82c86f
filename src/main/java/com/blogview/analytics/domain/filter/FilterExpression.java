package com.blogview.analytics.domain.filter;

import java.util.Map;

/**
 * Parsed boolean filter tree: either a {@link FilterLeaf} condition or a {@link FilterGroup}.
 *
 * Produced by {@link FilterExpressionParser}, turned into a {@link FilterPredicate}
 * by {@link FilterExpressionEvaluator}.
 */
public abstract class FilterExpression {

    FilterExpression() {
    }

    /**
     * Canonical structure used for cache keys. Group children are sorted, so two trees
     * that differ only in child order have the same canonical form.
     */
    public abstract Map<String, Object> toCanonicalMap();

    /**
     * Nesting depth; a single leaf has depth 1.
     */
    public abstract int depth();
}
