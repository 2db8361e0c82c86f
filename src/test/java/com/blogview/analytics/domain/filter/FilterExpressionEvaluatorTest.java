package com.blogview.analytics.domain.filter;

import com.blogview.analytics.config.AnalyticsProperties;
import com.blogview.analytics.domain.exception.AnalyticsValidationException;
import com.blogview.analytics.domain.exception.ExpressionTooDeepException;
import com.blogview.analytics.domain.exception.FieldNotAllowedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FilterExpressionEvaluatorTest {

    private static final Set<String> ALLOWED = Set.of("timestamp", "country", "blog");

    private FilterExpressionEvaluator evaluator;

    @BeforeEach
    void setUp() {
        evaluator = new FilterExpressionEvaluator(new AnalyticsProperties());
    }

    @Test
    @DisplayName("not[A, B] is the negation of A AND B for every truth assignment")
    void testNot_IsNand() {
        FilterExpression nand = FilterGroup.of(Combinator.NOT,
                new FilterLeaf("blog.id", Operator.EQ, 1L),
                new FilterLeaf("country.code", Operator.EQ, "US"));
        FilterPredicate predicate = evaluator.evaluate(nand, ALLOWED);

        for (boolean a : new boolean[]{true, false}) {
            for (boolean b : new boolean[]{true, false}) {
                FieldValues row = row(Map.of("blog.id", a ? 1L : 2L, "country.code", b ? "US" : "UK"));
                assertEquals(!(a && b), predicate.matches(row), "a=" + a + ", b=" + b);
            }
        }
    }

    @Test
    void testOr_AnyChildMatches() {
        FilterPredicate predicate = evaluator.evaluate(FilterGroup.of(Combinator.OR,
                new FilterLeaf("country.code", Operator.EQ, "US"),
                new FilterLeaf("country.code", Operator.EQ, "UK")), ALLOWED);

        assertTrue(predicate.matches(row(Map.of("country.code", "UK"))));
        assertFalse(predicate.matches(row(Map.of("country.code", "DE"))));
    }

    @Test
    @DisplayName("Empty and/or are always-true, empty not is always-false")
    void testEmptyGroups() {
        FieldValues anyRow = row(Map.of());

        assertTrue(evaluator.evaluate(FilterGroup.of(Combinator.AND), ALLOWED).matches(anyRow));
        assertTrue(evaluator.evaluate(FilterGroup.of(Combinator.OR), ALLOWED).matches(anyRow));
        assertFalse(evaluator.evaluate(FilterGroup.of(Combinator.NOT), ALLOWED).matches(anyRow));
        assertEquals(FilterPredicate.alwaysFalse(), evaluator.evaluate(FilterGroup.of(Combinator.NOT), ALLOWED));
    }

    @Test
    @DisplayName("Disallowed fields fail regardless of operator or value")
    void testAllowList() {
        for (Operator operator : Operator.values()) {
            FilterExpression leaf = new FilterLeaf("viewer.username", operator, "x");
            FieldNotAllowedException ex = assertThrows(FieldNotAllowedException.class,
                    () -> evaluator.evaluate(leaf, ALLOWED));
            assertEquals("viewer.username", ex.getField());
        }

        FilterExpression nested = FilterGroup.of(Combinator.OR,
                new FilterLeaf("blog.id", Operator.EQ, 1L),
                FilterGroup.of(Combinator.AND, new FilterLeaf("ipAddress", Operator.EQ, "127.0.0.1")));
        assertThrows(FieldNotAllowedException.class, () -> evaluator.evaluate(nested, ALLOWED));
    }

    @Test
    void testAllowList_EmptyAllowsNothing() {
        assertThrows(FieldNotAllowedException.class,
                () -> evaluator.evaluate(new FilterLeaf("timestamp", Operator.GT, "2024-01-01"), Set.of()));
    }

    @Test
    void testAllowList_ConfiguredDefaults() {
        FilterPredicate predicate = evaluator.evaluate(new FilterLeaf("blog.author.username", Operator.EQ, "alice"));

        assertTrue(predicate.matches(row(Map.of("blog.author.username", "alice"))));
    }

    @Test
    void testTextOperators_CaseInsensitive() {
        FilterPredicate contains = evaluator.evaluate(new FilterLeaf("blog.title", Operator.CONTAINS, "JAVA"), ALLOWED);
        FilterPredicate startsWith = evaluator.evaluate(new FilterLeaf("blog.title", Operator.STARTSWITH, "intro"), ALLOWED);

        FieldValues row = row(Map.of("blog.title", "Intro to Java Streams"));
        assertTrue(contains.matches(row));
        assertTrue(startsWith.matches(row));
        assertFalse(startsWith.matches(row(Map.of("blog.title", "Java intro"))));
    }

    @Test
    void testOrderingOperators_CoerceValues() {
        FilterPredicate after = evaluator.evaluate(new FilterLeaf("timestamp", Operator.GTE, "2024-03-01"), ALLOWED);
        FilterPredicate lowIds = evaluator.evaluate(new FilterLeaf("blog.id", Operator.LT, 10L), ALLOWED);

        assertTrue(after.matches(row(Map.of("timestamp", Instant.parse("2024-03-01T00:00:00Z")))));
        assertFalse(after.matches(row(Map.of("timestamp", Instant.parse("2024-02-29T23:59:59Z")))));
        assertTrue(lowIds.matches(row(Map.of("blog.id", 9L))));
        assertFalse(lowIds.matches(row(Map.of("blog.id", 10L))));
    }

    @Test
    @DisplayName("Fractional numbers are rejected for integral fields instead of being truncated")
    void testFractionalValue_IntegralField() {
        FilterPredicate fractional = evaluator.evaluate(new FilterLeaf("blog.id", Operator.EQ, 1.5d), ALLOWED);
        FieldValues blogOne = row(Map.of("blog.id", 1L));

        AnalyticsValidationException ex = assertThrows(AnalyticsValidationException.class,
                () -> fractional.matches(blogOne));
        assertEquals("Value '1.5' is not a valid Long.", ex.getMessage());

        assertTrue(evaluator.evaluate(new FilterLeaf("blog.id", Operator.EQ, 1.0d), ALLOWED).matches(blogOne));
        assertFalse(evaluator.evaluate(new FilterLeaf("blog.id", Operator.GT, 1.0d), ALLOWED).matches(blogOne));
    }

    @Test
    @DisplayName("Plain dates in expressions start at midnight of the configured zone")
    void testPlainDate_UsesConfiguredZone() {
        AnalyticsProperties properties = new AnalyticsProperties();
        properties.setTimeZone(ZoneId.of("Europe/Berlin"));
        FilterExpressionEvaluator berlin = new FilterExpressionEvaluator(properties);

        FilterPredicate after = berlin.evaluate(new FilterLeaf("timestamp", Operator.GTE, "2024-03-01"), ALLOWED);

        assertTrue(after.matches(row(Map.of("timestamp", Instant.parse("2024-02-29T23:00:00Z")))));
        assertFalse(after.matches(row(Map.of("timestamp", Instant.parse("2024-02-29T22:59:59Z")))));

        FilterPredicate title = berlin.evaluate(new FilterLeaf("blog.title", Operator.EQ, "2024-03-01"), ALLOWED);
        assertTrue(title.matches(row(Map.of("blog.title", "2024-03-01"))));
    }

    @Test
    void testMissingValue_OnlyNeqMatches() {
        FieldValues noCountry = row(Map.of());

        assertFalse(evaluator.evaluate(new FilterLeaf("country.code", Operator.EQ, "US"), ALLOWED).matches(noCountry));
        assertTrue(evaluator.evaluate(new FilterLeaf("country.code", Operator.NEQ, "US"), ALLOWED).matches(noCountry));
    }

    @Test
    void testTooDeep() {
        AnalyticsProperties properties = new AnalyticsProperties();
        properties.setMaxExpressionDepth(2);
        FilterExpressionEvaluator shallow = new FilterExpressionEvaluator(properties);

        FilterExpression leaf = new FilterLeaf("blog.id", Operator.EQ, 1L);
        shallow.evaluate(FilterGroup.of(Combinator.AND, leaf), ALLOWED);

        assertThrows(ExpressionTooDeepException.class,
                () -> shallow.evaluate(FilterGroup.of(Combinator.AND, FilterGroup.of(Combinator.AND, leaf)), ALLOWED));
    }

    private static FieldValues row(Map<String, Object> values) {
        return values::get;
    }
}
