package com.blogview.analytics.domain.model;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;

/**
 * Width of a time-series bucket.
 */
public enum BucketWidth {

    DAY,
    WEEK,
    MONTH;

    /**
     * Granularity for a timestamp span: more than a year is monthly,
     * more than 30 days is weekly, anything shorter is daily.
     */
    public static BucketWidth forSpan(Instant min, Instant max) {
        long days = Duration.between(min, max).toDays();
        if (days > 365) {
            return MONTH;
        }
        if (days > 30) {
            return WEEK;
        }
        return DAY;
    }

    /**
     * Start of the bucket containing the given day. Weeks start on Monday.
     */
    public LocalDate truncate(LocalDate day) {
        switch (this) {
            case WEEK:
                return day.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            case MONTH:
                return day.withDayOfMonth(1);
            default:
                return day;
        }
    }
}
