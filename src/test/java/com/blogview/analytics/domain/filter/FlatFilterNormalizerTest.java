package com.blogview.analytics.domain.filter;

import com.blogview.analytics.config.AnalyticsProperties;
import com.blogview.analytics.domain.exception.AnalyticsValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FlatFilterNormalizerTest {

    private FlatFilterNormalizer normalizer;

    @BeforeEach
    void setUp() {
        AnalyticsProperties properties = new AnalyticsProperties();
        normalizer = new FlatFilterNormalizer(new FilterExpressionEvaluator(properties), properties);
    }

    @Test
    void testEmptyFilter_MatchesEverything() {
        assertEquals(FilterPredicate.alwaysTrue(), normalizer.normalize(FlatFilter.empty(), FilterTarget.RAW_EVENTS));
        assertEquals(FilterPredicate.alwaysTrue(), normalizer.normalize(FlatFilter.empty(), FilterTarget.DAILY_SUMMARY));
    }

    @Test
    @DisplayName("year is a half-open range and wins over explicit dates")
    void testYear() {
        FlatFilter filter = FlatFilter.builder()
                .year(2024)
                .startDate(Instant.parse("2020-01-01T00:00:00Z"))
                .build();
        FilterPredicate predicate = normalizer.normalize(filter, FilterTarget.RAW_EVENTS);

        assertTrue(predicate.matches(view(Instant.parse("2024-01-01T00:00:00Z"), "US")));
        assertTrue(predicate.matches(view(Instant.parse("2024-12-31T23:59:59Z"), "US")));
        assertFalse(predicate.matches(view(Instant.parse("2025-01-01T00:00:00Z"), "US")));
        assertFalse(predicate.matches(view(Instant.parse("2023-12-31T23:59:59Z"), "US")));
    }

    @Test
    void testExplicitDates_Inclusive() {
        Instant start = Instant.parse("2024-03-01T10:00:00Z");
        Instant end = Instant.parse("2024-03-02T10:00:00Z");
        FilterPredicate predicate = normalizer.normalize(
                FlatFilter.builder().startDate(start).endDate(end).build(), FilterTarget.RAW_EVENTS);

        assertTrue(predicate.matches(view(start, "US")));
        assertTrue(predicate.matches(view(end, "US")));
        assertFalse(predicate.matches(view(end.plusSeconds(1), "US")));
    }

    @Test
    @DisplayName("Summary bounds are truncated to dates")
    void testSummaryDatesAreDateOnly() {
        FlatFilter filter = FlatFilter.builder()
                .startDate(Instant.parse("2024-03-01T10:00:00Z"))
                .endDate(Instant.parse("2024-03-02T10:00:00Z"))
                .build();
        FilterPredicate predicate = normalizer.normalize(filter, FilterTarget.DAILY_SUMMARY);

        assertTrue(predicate.matches(summary(LocalDate.of(2024, 3, 1))));
        assertTrue(predicate.matches(summary(LocalDate.of(2024, 3, 2))));
        assertFalse(predicate.matches(summary(LocalDate.of(2024, 3, 3))));
    }

    @Test
    void testCountryInclusionAndExclusion() {
        FlatFilter filter = FlatFilter.builder()
                .countryCodes(Set.of("US", "UK"))
                .excludeCountryCodes(Set.of("UK"))
                .build();
        FilterPredicate predicate = normalizer.normalize(filter, FilterTarget.RAW_EVENTS);

        Instant now = Instant.parse("2024-01-01T00:00:00Z");
        assertTrue(predicate.matches(view(now, "US")));
        assertFalse(predicate.matches(view(now, "UK")));
        assertFalse(predicate.matches(view(now, "DE")));
    }

    @Test
    void testExclusion_KeepsRowsWithoutCountry() {
        FilterPredicate predicate = normalizer.normalize(
                FlatFilter.builder().excludeCountryCodes(Set.of("SPAM")).build(), FilterTarget.RAW_EVENTS);

        assertTrue(predicate.matches(view(Instant.parse("2024-01-01T00:00:00Z"), null)));
    }

    @Test
    @DisplayName("blog_id filters raw views and is ignored on summaries")
    void testBlogId() {
        FlatFilter filter = FlatFilter.builder().blogId(7L).build();

        FilterPredicate raw = normalizer.normalize(filter, FilterTarget.RAW_EVENTS);
        assertEquals(FilterPredicate.compare("blog.id", Operator.EQ, 7L), raw);

        assertEquals(FilterPredicate.alwaysTrue(), normalizer.normalize(filter, FilterTarget.DAILY_SUMMARY));
    }

    @Test
    void testAuthor() {
        FilterPredicate summary = normalizer.normalize(
                FlatFilter.builder().authorUsername("alice").build(), FilterTarget.DAILY_SUMMARY);

        assertEquals(FilterPredicate.compare("author.username", Operator.EQ, "alice"), summary);
    }

    @Test
    void testExpression_AndedOnRawEvents() {
        FlatFilter filter = FlatFilter.builder()
                .countryCodes(Set.of("US"))
                .expression(new FilterLeaf("blog.title", Operator.STARTSWITH, "java"))
                .build();
        FilterPredicate predicate = normalizer.normalize(filter, FilterTarget.RAW_EVENTS);

        Map<String, Object> row = new HashMap<>();
        row.put("country.code", "US");
        row.put("blog.title", "Java Records");
        assertTrue(predicate.matches(row::get));

        row.put("blog.title", "Kotlin");
        assertFalse(predicate.matches(row::get));
    }

    @Test
    void testExpression_RejectedOnSummaries() {
        FlatFilter filter = FlatFilter.builder()
                .expression(new FilterLeaf("blog.id", Operator.EQ, 1L))
                .build();

        assertThrows(AnalyticsValidationException.class,
                () -> normalizer.normalize(filter, FilterTarget.DAILY_SUMMARY));
    }

    private static FieldValues view(Instant timestamp, String countryCode) {
        Map<String, Object> values = new HashMap<>();
        values.put("timestamp", timestamp);
        values.put("country.code", countryCode);
        return values::get;
    }

    private static FieldValues summary(LocalDate date) {
        return path -> "date".equals(path) ? date : null;
    }
}
