package com.blogview.analytics.domain.mapper;

import com.blogview.analytics.config.AnalyticsProperties;
import com.blogview.analytics.domain.exception.AnalyticsValidationException;
import com.blogview.analytics.domain.filter.FilterExpressionParser;
import com.blogview.analytics.domain.filter.FlatFilter;
import com.blogview.analytics.domain.model.AnalyticsFilterRequest;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps an {@link AnalyticsFilterRequest} to a {@link FlatFilter}.
 *
 * A relative {@code range} ends now and replaces any explicit dates. A plain
 * {@code end_date} covers the whole day.
 */
@Component
@RequiredArgsConstructor
public class FlatFilterMapper {

    private static final Map<String, Duration> RANGES = Map.of(
            "day", Duration.ofDays(1),
            "week", Duration.ofDays(7),
            "month", Duration.ofDays(30),
            "year", Duration.ofDays(365));

    private final Clock clock;
    private final FilterExpressionParser expressionParser;
    private final AnalyticsProperties properties;

    public FlatFilter toFlatFilter(AnalyticsFilterRequest request) {
        if (request == null) {
            return FlatFilter.empty();
        }

        Instant startDate = parseDate(request.getStartDate(), "start_date", false);
        Instant endDate = parseDate(request.getEndDate(), "end_date", true);
        if (startDate != null && endDate != null && startDate.isAfter(endDate)) {
            throw new AnalyticsValidationException("start_date must not be after end_date.");
        }

        if (request.getRange() != null) {
            Duration duration = RANGES.get(request.getRange().toLowerCase(Locale.ROOT));
            if (duration == null) {
                throw new AnalyticsValidationException(
                        "Invalid range: " + request.getRange() + ". Expected one of day, week, month, year.");
            }
            endDate = clock.instant();
            startDate = endDate.minus(duration);
        }

        return FlatFilter.builder()
                .year(request.getYear())
                .startDate(startDate)
                .endDate(endDate)
                .countryCodes(toSet(request.getCountryCodes()))
                .excludeCountryCodes(toSet(request.getExcludeCountryCodes()))
                .authorUsername(request.getAuthorUsername())
                .blogId(request.getBlogId())
                .expression(hasExpression(request.getFilter()) ? expressionParser.parse(request.getFilter()) : null)
                .build();
    }

    private Instant parseDate(String text, String name, boolean endOfDay) {
        if (text == null || text.isBlank()) {
            return null;
        }
        ZoneId zone = properties.getTimeZone();
        try {
            if (text.length() == 10) {
                LocalDate date = LocalDate.parse(text);
                return endOfDay
                        ? date.plusDays(1).atStartOfDay(zone).toInstant().minus(1, ChronoUnit.MICROS)
                        : date.atStartOfDay(zone).toInstant();
            }
            if (text.endsWith("Z") || text.matches(".*[+-]\\d{2}:?\\d{2}$")) {
                return OffsetDateTime.parse(text).toInstant();
            }
            return LocalDateTime.parse(text).atZone(zone).toInstant();
        } catch (DateTimeParseException e) {
            throw new AnalyticsValidationException("Invalid " + name + ": " + text, e);
        }
    }

    private static Set<String> toSet(List<String> values) {
        return values == null ? null : new LinkedHashSet<>(values);
    }

    private static boolean hasExpression(JsonNode filter) {
        return filter != null && !filter.isNull() && !filter.isMissingNode();
    }
}
