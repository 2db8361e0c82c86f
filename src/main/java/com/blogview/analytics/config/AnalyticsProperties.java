package com.blogview.analytics.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Typed configuration for app.analytics.* (filter allow-list, limits, bucketing zone).
 */
@ConfigurationProperties(prefix = "app.analytics")
@Getter
@Setter
public class AnalyticsProperties {

    /** Fields (or first segment of dotted paths) that filter expressions may reference. */
    private Set<String> allowedFilterFields = new LinkedHashSet<>(List.of("timestamp", "country", "blog"));

    /** Nesting limit for filter expressions. */
    private int maxExpressionDepth = 32;

    /** Row limit of the top analytics. */
    private int topLimit = 10;

    /** Zone used for calendar buckets and date-only summary bounds. */
    private ZoneId timeZone = ZoneId.of("UTC");
}
