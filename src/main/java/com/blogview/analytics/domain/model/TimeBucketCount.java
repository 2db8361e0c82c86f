package com.blogview.analytics.domain.model;

import lombok.Value;

import java.time.LocalDate;

@Value
public class TimeBucketCount {

    LocalDate bucketStart;
    long views;
    long distinctBlogs;
}
