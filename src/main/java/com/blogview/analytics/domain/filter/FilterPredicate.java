package com.blogview.analytics.domain.filter;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Backing-store independent boolean filter over a single row.
 *
 * Both the expression engine and the flat filter normalizer lower to this tree.
 * It is evaluated in-process through {@link #matches(FieldValues)} and translated
 * to JPA Criteria by a {@link Visitor}.
 *
 * Instances are immutable.
 */
public abstract class FilterPredicate {

    private static final FilterPredicate ALWAYS_TRUE = new Constant(true);
    private static final FilterPredicate ALWAYS_FALSE = new Constant(false);

    public abstract boolean matches(FieldValues row);

    public abstract <R> R accept(Visitor<R> visitor);

    public static FilterPredicate alwaysTrue() {
        return ALWAYS_TRUE;
    }

    public static FilterPredicate alwaysFalse() {
        return ALWAYS_FALSE;
    }

    public static FilterPredicate compare(String field, Operator operator, Object value) {
        return new Comparison(field, operator, value);
    }

    public static FilterPredicate in(String field, Collection<?> values) {
        return new InSet(field, values);
    }

    /**
     * Conjunction of the given predicates in order. Nested conjunctions are flattened.
     */
    public static FilterPredicate and(List<FilterPredicate> operands) {
        return junction(operands, true);
    }

    public static FilterPredicate and(FilterPredicate... operands) {
        return and(List.of(operands));
    }

    public static FilterPredicate or(List<FilterPredicate> operands) {
        return junction(operands, false);
    }

    public static FilterPredicate or(FilterPredicate... operands) {
        return or(List.of(operands));
    }

    public static FilterPredicate not(FilterPredicate operand) {
        if (operand instanceof Constant) {
            return ((Constant) operand).value ? ALWAYS_FALSE : ALWAYS_TRUE;
        }
        return new Not(operand);
    }

    private static FilterPredicate junction(List<FilterPredicate> operands, boolean conjunction) {
        if (operands.isEmpty()) {
            throw new IllegalArgumentException("A junction needs at least one operand");
        }
        if (operands.size() == 1) {
            return operands.get(0);
        }
        List<FilterPredicate> flat = new ArrayList<>();
        for (FilterPredicate operand : operands) {
            if (operand instanceof Junction && ((Junction) operand).conjunction == conjunction) {
                flat.addAll(((Junction) operand).operands);
            } else {
                flat.add(operand);
            }
        }
        return new Junction(flat, conjunction);
    }

    public interface Visitor<R> {

        R visitConstant(boolean value);

        R visitComparison(Comparison comparison);

        R visitInSet(InSet inSet);

        R visitAnd(List<FilterPredicate> operands);

        R visitOr(List<FilterPredicate> operands);

        R visitNot(FilterPredicate operand);
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class Constant extends FilterPredicate {

        private final boolean value;

        private Constant(boolean value) {
            this.value = value;
        }

        @Override
        public boolean matches(FieldValues row) {
            return value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConstant(value);
        }

        @Override
        public String toString() {
            return value ? "TRUE" : "FALSE";
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class Comparison extends FilterPredicate {

        private final String field;
        private final Operator operator;
        private final Object value;

        private Comparison(String field, Operator operator, Object value) {
            this.field = field;
            this.operator = operator;
            this.value = value;
        }

        @Override
        public boolean matches(FieldValues row) {
            Object actual = row.valueOf(field);
            if (actual == null) {
                return operator.test(null, value);
            }
            return operator.test(actual, ValueCoercion.coerce(value, actual.getClass()));
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitComparison(this);
        }

        @Override
        public String toString() {
            return field + " " + operator.getCode() + " " + value;
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class InSet extends FilterPredicate {

        private final String field;
        private final Set<Object> values;

        private InSet(String field, Collection<?> values) {
            this.field = field;
            this.values = Collections.unmodifiableSet(new LinkedHashSet<>(values));
        }

        @Override
        public boolean matches(FieldValues row) {
            Object actual = row.valueOf(field);
            if (actual == null) {
                return false;
            }
            for (Object candidate : values) {
                if (actual.equals(ValueCoercion.coerce(candidate, actual.getClass()))) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitInSet(this);
        }

        @Override
        public String toString() {
            return field + " in " + values;
        }
    }

    @EqualsAndHashCode(callSuper = false)
    private static final class Junction extends FilterPredicate {

        private final List<FilterPredicate> operands;
        private final boolean conjunction;

        private Junction(List<FilterPredicate> operands, boolean conjunction) {
            this.operands = List.copyOf(operands);
            this.conjunction = conjunction;
        }

        @Override
        public boolean matches(FieldValues row) {
            for (FilterPredicate operand : operands) {
                if (operand.matches(row) != conjunction) {
                    return !conjunction;
                }
            }
            return conjunction;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return conjunction ? visitor.visitAnd(operands) : visitor.visitOr(operands);
        }

        @Override
        public String toString() {
            return "(" + String.join(conjunction ? " AND " : " OR ", operands.stream().map(String::valueOf).toList()) + ")";
        }
    }

    @EqualsAndHashCode(callSuper = false)
    private static final class Not extends FilterPredicate {

        private final FilterPredicate operand;

        private Not(FilterPredicate operand) {
            this.operand = operand;
        }

        @Override
        public boolean matches(FieldValues row) {
            return !operand.matches(row);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNot(operand);
        }

        @Override
        public String toString() {
            return "NOT " + operand;
        }
    }
}
