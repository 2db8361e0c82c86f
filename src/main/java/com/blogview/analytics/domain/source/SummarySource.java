package com.blogview.analytics.domain.source;

import com.blogview.analytics.domain.filter.FilterPredicate;
import com.blogview.analytics.domain.model.Dimension;
import com.blogview.analytics.domain.model.SummaryGroup;

import java.util.List;

/**
 * Query capabilities over pre-aggregated daily summary rows.
 */
public interface SummarySource {

    /**
     * Sums of unique blogs and total views per group, in no particular order.
     *
     * @throws com.blogview.analytics.domain.exception.InvalidDimensionException
     *         when the summary rows carry no such dimension
     */
    List<SummaryGroup> groupBySummary(FilterPredicate predicate, Dimension dimension);
}
