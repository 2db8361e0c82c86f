package com.blogview.analytics.infrastructure.persistence.query;

import com.blogview.analytics.domain.exception.AnalyticsValidationException;
import jakarta.persistence.criteria.From;
import jakarta.persistence.criteria.JoinType;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Root;

import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Resolves dotted field paths ({@code blog.author.username}) against a criteria root.
 *
 * Every association hop is a LEFT join, reused for the lifetime of one query, so rows
 * with an empty association (e.g. unknown country) stay visible to negated filters and
 * show up as a null group key.
 */
public class CriteriaPathResolver {

    private static final Set<Class<?>> FILTERABLE_TYPES = Set.of(
            String.class, Long.class, Integer.class, Boolean.class, Double.class,
            long.class, int.class, boolean.class, double.class,
            Instant.class, LocalDate.class);

    private final Root<?> root;
    private final Map<String, From<?, ?>> joins = new HashMap<>();

    public CriteriaPathResolver(Root<?> root) {
        this.root = root;
    }

    /**
     * @throws AnalyticsValidationException when the path does not end on a basic value
     */
    public Path<?> resolve(String field) {
        String[] segments = field.split("\\.", -1);
        Path<?> path;
        try {
            From<?, ?> from = root;
            String prefix = null;
            for (int i = 0; i < segments.length - 1; i++) {
                prefix = prefix == null ? segments[i] : prefix + "." + segments[i];
                From<?, ?> parent = from;
                String segment = segments[i];
                from = joins.computeIfAbsent(prefix, key -> parent.join(segment, JoinType.LEFT));
            }
            path = from.get(segments[segments.length - 1]);
        } catch (RuntimeException e) {
            throw new AnalyticsValidationException("Unknown filter field: " + field, e);
        }

        if (!FILTERABLE_TYPES.contains(path.getJavaType())) {
            throw new AnalyticsValidationException("Field '" + field + "' does not resolve to a filterable value.");
        }
        return path;
    }
}
