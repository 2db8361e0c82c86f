package com.blogview.analytics.domain.model;

import lombok.Value;

import java.time.Instant;

@Value
public class TimestampRange {

    Instant min;
    Instant max;
}
