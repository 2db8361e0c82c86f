package com.blogview.analytics.infrastructure.persistence.query;

import com.blogview.analytics.domain.exception.AnalyticsValidationException;
import com.blogview.analytics.domain.filter.FilterPredicate;
import com.blogview.analytics.domain.filter.Operator;
import com.blogview.analytics.domain.filter.ValueCoercion;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Translates a {@link FilterPredicate} into a JPA criteria predicate.
 *
 * Values are always bound as parameters. Each leaf is made null-safe so it evaluates to
 * TRUE or FALSE, never UNKNOWN; negation then behaves like {@link FilterPredicate#matches}.
 */
public class CriteriaPredicateBuilder implements FilterPredicate.Visitor<Predicate> {

    private static final char LIKE_ESCAPE = '\\';

    private final CriteriaBuilder cb;
    private final CriteriaPathResolver paths;

    public CriteriaPredicateBuilder(CriteriaBuilder cb, CriteriaPathResolver paths) {
        this.cb = cb;
        this.paths = paths;
    }

    public static Predicate build(CriteriaBuilder cb, CriteriaPathResolver paths, FilterPredicate predicate) {
        return predicate.accept(new CriteriaPredicateBuilder(cb, paths));
    }

    @Override
    public Predicate visitConstant(boolean value) {
        return value ? cb.conjunction() : cb.disjunction();
    }

    @Override
    public Predicate visitComparison(FilterPredicate.Comparison comparison) {
        Path<?> path = paths.resolve(comparison.getField());
        Operator operator = comparison.getOperator();
        Object value = ValueCoercion.coerce(comparison.getValue(), path.getJavaType());

        switch (operator) {
            case EQ:
                return cb.and(cb.isNotNull(path), cb.equal(path, value));
            case NEQ:
                return cb.or(cb.isNull(path), cb.notEqual(path, value));
            case CONTAINS:
                return cb.and(cb.isNotNull(path), cb.like(lower(path, operator), "%" + escapeLike(value) + "%", LIKE_ESCAPE));
            case STARTSWITH:
                return cb.and(cb.isNotNull(path), cb.like(lower(path, operator), escapeLike(value) + "%", LIKE_ESCAPE));
            default:
                return cb.and(cb.isNotNull(path), ordering(operator, path, value));
        }
    }

    @Override
    public Predicate visitInSet(FilterPredicate.InSet inSet) {
        if (inSet.getValues().isEmpty()) {
            return cb.disjunction();
        }
        Path<?> path = paths.resolve(inSet.getField());
        List<Object> values = new ArrayList<>(inSet.getValues().size());
        for (Object value : inSet.getValues()) {
            values.add(ValueCoercion.coerce(value, path.getJavaType()));
        }
        return cb.and(cb.isNotNull(path), path.in(values));
    }

    @Override
    public Predicate visitAnd(List<FilterPredicate> operands) {
        return cb.and(translate(operands));
    }

    @Override
    public Predicate visitOr(List<FilterPredicate> operands) {
        return cb.or(translate(operands));
    }

    @Override
    public Predicate visitNot(FilterPredicate operand) {
        return cb.not(operand.accept(this));
    }

    private Predicate[] translate(List<FilterPredicate> operands) {
        Predicate[] predicates = new Predicate[operands.size()];
        for (int i = 0; i < operands.size(); i++) {
            predicates[i] = operands.get(i).accept(this);
        }
        return predicates;
    }

    private Predicate ordering(Operator operator, Path<?> path, Object value) {
        Expression<Comparable> expression = (Expression<Comparable>) path;
        Comparable bound = (Comparable) value;
        switch (operator) {
            case GT:
                return cb.greaterThan(expression, bound);
            case GTE:
                return cb.greaterThanOrEqualTo(expression, bound);
            case LT:
                return cb.lessThan(expression, bound);
            case LTE:
                return cb.lessThanOrEqualTo(expression, bound);
            default:
                throw new IllegalStateException("Not an ordering operator: " + operator);
        }
    }

    private Expression<String> lower(Path<?> path, Operator operator) {
        if (path.getJavaType() != String.class) {
            throw new AnalyticsValidationException("Operator '" + operator.getCode() + "' requires a text field.");
        }
        return cb.lower((Expression<String>) path);
    }

    private String escapeLike(Object value) {
        String text = value.toString().toLowerCase(Locale.ROOT);
        return text.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
