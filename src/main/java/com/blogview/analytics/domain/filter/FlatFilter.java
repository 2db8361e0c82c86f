package com.blogview.analytics.domain.filter;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Normalized filter parameters shared by the analytics operations.
 *
 * {@code year} takes precedence over {@code startDate}/{@code endDate}. Country inclusion and
 * exclusion may both be set; exclusion applies after inclusion. Absent fields do not filter.
 */
@Value
@Builder(toBuilder = true)
public class FlatFilter {

    Integer year;
    Instant startDate;
    Instant endDate;
    Set<String> countryCodes;
    Set<String> excludeCountryCodes;
    String authorUsername;
    Long blogId;

    /** Optional expression ANDed with the named filters. */
    FilterExpression expression;

    public static FlatFilter empty() {
        return FlatFilter.builder().build();
    }

    public boolean hasCountryCodes() {
        return countryCodes != null && !countryCodes.isEmpty();
    }

    public boolean hasExcludeCountryCodes() {
        return excludeCountryCodes != null && !excludeCountryCodes.isEmpty();
    }

    /**
     * Order-insensitive representation for cache keys: sorted keys, country sets as sorted
     * lists, absent and empty values omitted.
     */
    public Map<String, Object> toCanonicalMap() {
        Map<String, Object> canonical = new TreeMap<>();
        if (year != null) {
            canonical.put("year", year);
        } else {
            if (startDate != null) {
                canonical.put("start_date", startDate.toString());
            }
            if (endDate != null) {
                canonical.put("end_date", endDate.toString());
            }
        }
        if (hasCountryCodes()) {
            canonical.put("country_codes", new ArrayList<>(new TreeSet<>(countryCodes)));
        }
        if (hasExcludeCountryCodes()) {
            canonical.put("exclude_country_codes", new ArrayList<>(new TreeSet<>(excludeCountryCodes)));
        }
        if (authorUsername != null) {
            canonical.put("author_username", authorUsername);
        }
        if (blogId != null) {
            canonical.put("blog_id", blogId);
        }
        if (expression != null) {
            canonical.put("filter", expression.toCanonicalMap());
        }
        return canonical;
    }

    List<String> sortedCountryCodes() {
        return new ArrayList<>(new TreeSet<>(countryCodes));
    }

    List<String> sortedExcludeCountryCodes() {
        return new ArrayList<>(new TreeSet<>(excludeCountryCodes));
    }
}
