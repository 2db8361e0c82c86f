package com.blogview.analytics.domain.model;

import lombok.Value;

@Value
public class SummaryGroup {

    String key;
    long sumUniqueBlogs;
    long sumTotalViews;
}
