package com.blogview.analytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One row of an analytics result.
 *
 * Meaning of the axes depends on the operation:
 * grouped: key / distinct blogs / views;
 * top: key / views / secondary distinct count;
 * performance: bucket label / views / growth percent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalyticsPoint {

    private String x;
    private long y;
    private double z;
}
