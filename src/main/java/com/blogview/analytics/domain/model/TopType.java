package com.blogview.analytics.domain.model;

import com.blogview.analytics.domain.exception.AnalyticsValidationException;

/**
 * Ranking subject of the top analytics, with its secondary distinct metric:
 * blogs are ranked with the number of countries they were viewed from,
 * users and countries with the number of blogs viewed.
 */
public enum TopType {

    BLOG("blog", Dimension.BLOG_TITLE, DistinctTarget.COUNTRIES),
    USER("user", Dimension.AUTHOR_USERNAME, DistinctTarget.BLOGS),
    COUNTRY("country", Dimension.COUNTRY_CODE, DistinctTarget.BLOGS);

    private final String code;
    private final Dimension dimension;
    private final DistinctTarget secondaryMetric;

    TopType(String code, Dimension dimension, DistinctTarget secondaryMetric) {
        this.code = code;
        this.dimension = dimension;
        this.secondaryMetric = secondaryMetric;
    }

    public String getCode() {
        return code;
    }

    public Dimension getDimension() {
        return dimension;
    }

    public DistinctTarget getSecondaryMetric() {
        return secondaryMetric;
    }

    public static TopType fromCode(String code) {
        for (TopType type : values()) {
            if (type.code.equals(code)) {
                return type;
            }
        }
        throw new AnalyticsValidationException("Invalid top_type: " + code);
    }
}
