package com.blogview.analytics.domain.service;

import com.blogview.analytics.domain.model.AnalyticsPoint;
import com.blogview.analytics.domain.model.TimeBucketCount;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns chronological buckets into performance points with period-over-period growth.
 */
final class PerformanceSeries {

    private PerformanceSeries() {
    }

    static List<AnalyticsPoint> fromBuckets(List<TimeBucketCount> buckets) {
        List<AnalyticsPoint> points = new ArrayList<>(buckets.size());
        Long previousViews = null;
        for (TimeBucketCount bucket : buckets) {
            double growth = previousViews == null ? 0.0 : growth(previousViews, bucket.getViews());
            points.add(AnalyticsPoint.builder()
                    .x(bucket.getBucketStart() + " (" + bucket.getDistinctBlogs() + " blogs)")
                    .y(bucket.getViews())
                    .z(growth)
                    .build());
            previousViews = bucket.getViews();
        }
        return points;
    }

    /**
     * Percentage change rounded half-up to two decimals; 0.0 when there is nothing to compare to.
     */
    static double growth(long previous, long current) {
        if (previous == 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(current - previous)
                .multiply(BigDecimal.valueOf(100))
                .divide(BigDecimal.valueOf(previous), 2, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
