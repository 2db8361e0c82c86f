package com.blogview.analytics.domain.model;

/**
 * What a grouped query counts distinct occurrences of.
 */
public enum DistinctTarget {
    BLOGS,
    COUNTRIES
}
