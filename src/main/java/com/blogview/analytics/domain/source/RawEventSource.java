package com.blogview.analytics.domain.source;

import com.blogview.analytics.domain.filter.FilterPredicate;
import com.blogview.analytics.domain.model.BucketWidth;
import com.blogview.analytics.domain.model.Dimension;
import com.blogview.analytics.domain.model.DistinctTarget;
import com.blogview.analytics.domain.model.GroupCount;
import com.blogview.analytics.domain.model.TimeBucketCount;
import com.blogview.analytics.domain.model.TimestampRange;

import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

/**
 * Query capabilities over raw blog view rows.
 */
public interface RawEventSource {

    long count(FilterPredicate predicate);

    long countDistinct(FilterPredicate predicate, Dimension dimension);

    /**
     * View count and distinct count per group, in no particular order.
     */
    List<GroupCount> groupBy(FilterPredicate predicate, Dimension dimension, DistinctTarget distinctOf);

    /**
     * View count and distinct blog count per bucket, oldest bucket first.
     * Buckets without matching rows are omitted.
     */
    List<TimeBucketCount> timeBucketed(FilterPredicate predicate, BucketWidth width, ZoneId zone);

    /**
     * @return earliest and latest timestamp of the matching rows, empty when nothing matches
     */
    Optional<TimestampRange> minMaxTimestamp(FilterPredicate predicate);
}
