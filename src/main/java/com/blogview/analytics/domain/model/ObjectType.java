package com.blogview.analytics.domain.model;

import com.blogview.analytics.domain.exception.AnalyticsValidationException;

/**
 * Grouping of the grouped analytics: by viewer country or by blog author.
 */
public enum ObjectType {

    COUNTRY("country", Dimension.COUNTRY_CODE),
    USER("user", Dimension.AUTHOR_USERNAME);

    private final String code;
    private final Dimension dimension;

    ObjectType(String code, Dimension dimension) {
        this.code = code;
        this.dimension = dimension;
    }

    public String getCode() {
        return code;
    }

    public Dimension getDimension() {
        return dimension;
    }

    public static ObjectType fromCode(String code) {
        for (ObjectType type : values()) {
            if (type.code.equals(code)) {
                return type;
            }
        }
        throw new AnalyticsValidationException("Invalid object_type: " + code);
    }
}
