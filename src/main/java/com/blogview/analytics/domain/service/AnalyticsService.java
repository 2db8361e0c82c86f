package com.blogview.analytics.domain.service;

import com.blogview.analytics.config.AnalyticsProperties;
import com.blogview.analytics.domain.filter.FilterPredicate;
import com.blogview.analytics.domain.filter.FilterTarget;
import com.blogview.analytics.domain.filter.FlatFilter;
import com.blogview.analytics.domain.filter.FlatFilterNormalizer;
import com.blogview.analytics.domain.model.AnalyticsPoint;
import com.blogview.analytics.domain.model.BucketWidth;
import com.blogview.analytics.domain.model.DistinctTarget;
import com.blogview.analytics.domain.model.GroupCount;
import com.blogview.analytics.domain.model.ObjectType;
import com.blogview.analytics.domain.model.SummaryGroup;
import com.blogview.analytics.domain.model.TimeBucketCount;
import com.blogview.analytics.domain.model.TimestampRange;
import com.blogview.analytics.domain.model.TopType;
import com.blogview.analytics.domain.source.RawEventSource;
import com.blogview.analytics.domain.source.SummarySource;
import com.blogview.analytics.infrastructure.cache.AnalyticsCache;
import com.fasterxml.jackson.core.type.TypeReference;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Analytics over blog views.
 *
 * Query Flow:
 * 1. Normalize the filter to a predicate (validation errors surface here, before the cache)
 * 2. Check cache with a key derived from the canonical filter
 * 3. On a miss, aggregate through the query source
 * 4. Store result in cache (15 minutes)
 *
 * Result Shapes ({x, y, z}):
 * - grouped: key, distinct blogs, views
 * - top: key, views, distinct countries (blogs) or distinct blogs (users, countries)
 * - performance: "date (N blogs)", views, growth percent against the previous bucket
 * - grouped_fast: key, summed daily unique blogs, summed views, from daily summaries
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalyticsService {

    static final String OP_GROUPED = "grouped";
    static final String OP_TOP = "top";
    static final String OP_PERFORMANCE = "perf";
    static final String OP_GROUPED_FAST = "grouped_fast";

    private static final TypeReference<List<AnalyticsPoint>> POINTS = new TypeReference<>() {
    };

    private static final Comparator<AnalyticsPoint> BY_X = Comparator.comparing(
            AnalyticsPoint::getX, Comparator.nullsLast(Comparator.<String>naturalOrder()));

    static final Comparator<AnalyticsPoint> BY_Z_DESC =
            Comparator.comparingDouble(AnalyticsPoint::getZ).reversed().thenComparing(BY_X);

    static final Comparator<AnalyticsPoint> BY_Y_DESC =
            Comparator.comparingLong(AnalyticsPoint::getY).reversed().thenComparing(BY_X);

    private final FlatFilterNormalizer normalizer;
    private final RawEventSource rawEventSource;
    private final SummarySource summarySource;
    private final AnalyticsCache cache;
    private final AnalyticsProperties properties;
    private final MeterRegistry meterRegistry;

    /**
     * Views per country or per author, with the number of distinct blogs viewed.
     */
    @Transactional(readOnly = true, timeout = 10)
    public List<AnalyticsPoint> getGroupedAnalytics(ObjectType objectType, FlatFilter filter) {
        FilterPredicate predicate = normalizer.normalize(filter, FilterTarget.RAW_EVENTS);

        return execute(OP_GROUPED, params(objectType.getCode(), filter), () -> {
            List<GroupCount> groups = rawEventSource.groupBy(predicate, objectType.getDimension(),
                    DistinctTarget.BLOGS);
            List<AnalyticsPoint> points = new ArrayList<>(groups.size());
            for (GroupCount group : groups) {
                points.add(new AnalyticsPoint(group.getKey(), group.getDistinctCount(), group.getCount()));
            }
            points.sort(BY_Z_DESC);
            return points;
        });
    }

    /**
     * Top blogs, users or countries by views, limited to {@code app.analytics.top-limit} rows.
     */
    @Transactional(readOnly = true, timeout = 10)
    public List<AnalyticsPoint> getTopAnalytics(TopType topType, FlatFilter filter) {
        FilterPredicate predicate = normalizer.normalize(filter, FilterTarget.RAW_EVENTS);

        return execute(OP_TOP, params(topType.getCode(), filter), () -> {
            List<GroupCount> groups = rawEventSource.groupBy(predicate, topType.getDimension(),
                    topType.getSecondaryMetric());
            List<AnalyticsPoint> points = new ArrayList<>(groups.size());
            for (GroupCount group : groups) {
                points.add(new AnalyticsPoint(group.getKey(), group.getCount(), group.getDistinctCount()));
            }
            points.sort(BY_Y_DESC);
            int limit = Math.min(properties.getTopLimit(), points.size());
            return new ArrayList<>(points.subList(0, limit));
        });
    }

    /**
     * Views per time bucket with growth against the previous bucket.
     *
     * Bucket width follows the span of the matching rows: daily up to 30 days,
     * weekly up to a year, monthly beyond.
     */
    @Transactional(readOnly = true, timeout = 10)
    public List<AnalyticsPoint> getPerformanceAnalytics(FlatFilter filter) {
        FilterPredicate predicate = normalizer.normalize(filter, FilterTarget.RAW_EVENTS);

        return execute(OP_PERFORMANCE, params(null, filter), () -> {
            Optional<TimestampRange> range = rawEventSource.minMaxTimestamp(predicate);
            if (range.isEmpty()) {
                return Collections.emptyList();
            }
            BucketWidth width = BucketWidth.forSpan(range.get().getMin(), range.get().getMax());
            log.debug("Performance buckets: {} for {}", width, range.get());

            List<TimeBucketCount> buckets = rawEventSource.timeBucketed(predicate, width, properties.getTimeZone());
            return PerformanceSeries.fromBuckets(buckets);
        });
    }

    /**
     * Grouped analytics from the daily summary table.
     *
     * Same x and z as {@link #getGroupedAnalytics} once the rollup covers the range;
     * y sums the per-day unique blogs and can exceed the raw distinct count.
     */
    @Transactional(readOnly = true, timeout = 10)
    public List<AnalyticsPoint> getGroupedAnalyticsFast(ObjectType objectType, FlatFilter filter) {
        FilterPredicate predicate = normalizer.normalize(filter, FilterTarget.DAILY_SUMMARY);

        return execute(OP_GROUPED_FAST, params(objectType.getCode(), filter), () -> {
            List<SummaryGroup> groups = summarySource.groupBySummary(predicate, objectType.getDimension());
            List<AnalyticsPoint> points = new ArrayList<>(groups.size());
            for (SummaryGroup group : groups) {
                points.add(new AnalyticsPoint(group.getKey(), group.getSumUniqueBlogs(), group.getSumTotalViews()));
            }
            points.sort(BY_Z_DESC);
            return points;
        });
    }

    private List<AnalyticsPoint> execute(String operation, Map<String, Object> params,
                                         Supplier<List<AnalyticsPoint>> query) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            List<AnalyticsPoint> result = cache.getOrCompute(operation, params, POINTS, query);

            long nanos = sample.stop(Timer.builder("analytics.query.latency")
                    .tag("operation", operation)
                    .register(meterRegistry));

            Counter.builder("analytics.query.executed")
                    .tag("operation", operation)
                    .tag("result", "success")
                    .register(meterRegistry)
                    .increment();

            log.info("Query executed: {} -> {} rows, {} ms", operation, result.size(), nanos / 1_000_000);
            return result;

        } catch (RuntimeException e) {
            log.error("Error executing {} query: {}", operation, e.getMessage(), e);

            Counter.builder("analytics.query.executed")
                    .tag("operation", operation)
                    .tag("result", "error")
                    .register(meterRegistry)
                    .increment();

            throw e;
        }
    }

    private static Map<String, Object> params(String type, FlatFilter filter) {
        Map<String, Object> params = new LinkedHashMap<>();
        if (type != null) {
            params.put("type", type);
        }
        params.put("filters", filter.toCanonicalMap());
        return params;
    }
}
