package com.blogview.analytics.domain.model;

import lombok.Value;

/**
 * Raw view count of one group with its distinct count.
 */
@Value
public class GroupCount {

    String key;
    long count;
    long distinctCount;
}
