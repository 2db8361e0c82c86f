package com.blogview.analytics.domain.service;

import com.blogview.analytics.domain.model.AnalyticsPoint;
import com.blogview.analytics.domain.model.TimeBucketCount;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PerformanceSeriesTest {

    @Test
    @DisplayName("Growth of [100, 150, 0] is [0.0, 50.0, -100.0]")
    void testGrowth() {
        List<AnalyticsPoint> points = PerformanceSeries.fromBuckets(List.of(
                new TimeBucketCount(LocalDate.of(2024, 1, 1), 100, 4),
                new TimeBucketCount(LocalDate.of(2024, 1, 2), 150, 5),
                new TimeBucketCount(LocalDate.of(2024, 1, 3), 0, 0)));

        assertEquals(3, points.size());
        assertEquals(0.0, points.get(0).getZ());
        assertEquals(50.0, points.get(1).getZ());
        assertEquals(-100.0, points.get(2).getZ());

        assertEquals("2024-01-01 (4 blogs)", points.get(0).getX());
        assertEquals(150, points.get(1).getY());
    }

    @Test
    void testGrowth_AfterEmptyBucketIsZero() {
        assertEquals(0.0, PerformanceSeries.growth(0, 40));
    }

    @Test
    void testGrowth_RoundsHalfUp() {
        assertEquals(33.33, PerformanceSeries.growth(3, 4));
        assertEquals(-66.67, PerformanceSeries.growth(3, 1));
        assertEquals(0.01, PerformanceSeries.growth(20_000, 20_001));
    }

    @Test
    void testEmpty() {
        assertTrue(PerformanceSeries.fromBuckets(List.of()).isEmpty());
    }
}
