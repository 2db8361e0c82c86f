package com.blogview.analytics.domain.filter;

import com.blogview.analytics.config.AnalyticsProperties;
import com.blogview.analytics.domain.exception.ExpressionTooDeepException;
import com.blogview.analytics.domain.exception.FieldNotAllowedException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns a {@link FilterExpression} into a {@link FilterPredicate}, enforcing the field allow-list.
 *
 * Group semantics:
 * <ul>
 *   <li>children are combined left to right, the first child seeds the result</li>
 *   <li>{@code and} / {@code or} combine with AND / OR; an empty group is always-true</li>
 *   <li>{@code not} is the negation of the AND of its children; an empty {@code not} is always-false</li>
 * </ul>
 * Plain {@code yyyy-MM-dd} values mean midnight in the configured time zone, as for start_date.
 */
@Component
@RequiredArgsConstructor
public class FilterExpressionEvaluator {

    private static final Pattern PLAIN_DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");

    private final AnalyticsProperties properties;

    /**
     * Evaluate against the configured allow-list.
     */
    public FilterPredicate evaluate(FilterExpression expression) {
        return evaluate(expression, properties.getAllowedFilterFields());
    }

    public FilterPredicate evaluate(FilterExpression expression, Set<String> allowedFields) {
        return evaluate(expression, allowedFields, 1);
    }

    private FilterPredicate evaluate(FilterExpression expression, Set<String> allowedFields, int depth) {
        if (depth > properties.getMaxExpressionDepth()) {
            throw new ExpressionTooDeepException(properties.getMaxExpressionDepth());
        }
        if (expression instanceof FilterLeaf) {
            return evaluateLeaf((FilterLeaf) expression, allowedFields);
        }

        FilterGroup group = (FilterGroup) expression;
        List<FilterPredicate> operands = new ArrayList<>(group.getChildren().size());
        for (FilterExpression child : group.getChildren()) {
            operands.add(evaluate(child, allowedFields, depth + 1));
        }

        FilterPredicate combined;
        if (operands.isEmpty()) {
            combined = FilterPredicate.alwaysTrue();
        } else if (group.getCombinator() == Combinator.OR) {
            combined = FilterPredicate.or(operands);
        } else {
            combined = FilterPredicate.and(operands);
        }
        return group.getCombinator() == Combinator.NOT ? FilterPredicate.not(combined) : combined;
    }

    private FilterPredicate evaluateLeaf(FilterLeaf leaf, Set<String> allowedFields) {
        String field = leaf.getField();
        if (!allowedFields.contains(field)) {
            int dot = field.indexOf('.');
            String baseField = dot < 0 ? field : field.substring(0, dot);
            if (!allowedFields.contains(baseField)) {
                throw new FieldNotAllowedException(field);
            }
        }
        return FilterPredicate.compare(field, leaf.getOperator(), bindValue(leaf.getValue()));
    }

    private Object bindValue(Object value) {
        if (value instanceof String && PLAIN_DATE.matcher((String) value).matches()) {
            try {
                return LocalDate.parse((String) value).atStartOfDay(properties.getTimeZone());
            } catch (DateTimeParseException e) {
                // not a calendar date, compared as text
                return value;
            }
        }
        return value;
    }
}
