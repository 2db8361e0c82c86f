package com.blogview.analytics.domain.filter;

import com.blogview.analytics.config.AnalyticsProperties;
import com.blogview.analytics.domain.exception.AnalyticsValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Lowers a {@link FlatFilter} to a {@link FilterPredicate} for one backing dataset.
 *
 * <ul>
 *   <li>year: {@code [year-01-01, year+1-01-01)}, otherwise start_date / end_date as inclusive bounds</li>
 *   <li>country_codes: inclusion, exclude_country_codes: NOT inclusion</li>
 *   <li>author_username, blog_id: equality</li>
 *   <li>embedded expression: evaluated against the configured allow-list</li>
 * </ul>
 * Everything is ANDed; an empty filter selects all rows.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FlatFilterNormalizer {

    private final FilterExpressionEvaluator expressionEvaluator;
    private final AnalyticsProperties properties;

    public FilterPredicate normalize(FlatFilter filter, FilterTarget target) {
        List<FilterPredicate> parts = new ArrayList<>();
        ZoneId zone = properties.getTimeZone();

        // Date filters (year OR date range)
        if (filter.getYear() != null) {
            LocalDate firstDay = LocalDate.of(filter.getYear(), 1, 1);
            LocalDate nextYear = firstDay.plusYears(1);
            parts.add(FilterPredicate.compare(target.getTimeField(), Operator.GTE, bound(firstDay, target, zone)));
            parts.add(FilterPredicate.compare(target.getTimeField(), Operator.LT, bound(nextYear, target, zone)));
        } else {
            if (filter.getStartDate() != null) {
                parts.add(FilterPredicate.compare(target.getTimeField(), Operator.GTE,
                        bound(filter.getStartDate(), target, zone)));
            }
            if (filter.getEndDate() != null) {
                parts.add(FilterPredicate.compare(target.getTimeField(), Operator.LTE,
                        bound(filter.getEndDate(), target, zone)));
            }
        }

        // Country filters
        if (filter.hasCountryCodes()) {
            parts.add(FilterPredicate.in(target.getCountryCodeField(), filter.sortedCountryCodes()));
        }
        if (filter.hasExcludeCountryCodes()) {
            parts.add(FilterPredicate.not(
                    FilterPredicate.in(target.getCountryCodeField(), filter.sortedExcludeCountryCodes())));
        }

        // Author and blog filters
        if (filter.getAuthorUsername() != null) {
            parts.add(FilterPredicate.compare(target.getAuthorField(), Operator.EQ, filter.getAuthorUsername()));
        }
        if (filter.getBlogId() != null) {
            if (target.supportsBlogFilter()) {
                parts.add(FilterPredicate.compare(target.getBlogIdField(), Operator.EQ, filter.getBlogId()));
            } else {
                log.debug("Ignoring blog_id={} on {}: summary rows carry no blog", filter.getBlogId(), target);
            }
        }

        if (filter.getExpression() != null) {
            if (target != FilterTarget.RAW_EVENTS) {
                throw new AnalyticsValidationException("Filter expressions are only supported on raw view queries.");
            }
            parts.add(expressionEvaluator.evaluate(filter.getExpression()));
        }

        return parts.isEmpty() ? FilterPredicate.alwaysTrue() : FilterPredicate.and(parts);
    }

    private Object bound(LocalDate date, FilterTarget target, ZoneId zone) {
        return target.isDateOnly() ? date : date.atStartOfDay(zone).toInstant();
    }

    private Object bound(Instant instant, FilterTarget target, ZoneId zone) {
        return target.isDateOnly() ? LocalDate.ofInstant(instant, zone) : instant;
    }
}
