package com.blogview.analytics.domain.model;

import com.blogview.analytics.domain.exception.InvalidDimensionException;

/**
 * Grouping keys supported by the query sources.
 */
public enum Dimension {

    COUNTRY_CODE("country_code"),
    AUTHOR_USERNAME("author_username"),
    BLOG_TITLE("blog_title");

    private final String name;

    Dimension(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public static Dimension fromName(String name) {
        for (Dimension dimension : values()) {
            if (dimension.name.equals(name)) {
                return dimension;
            }
        }
        throw new InvalidDimensionException("Unsupported grouping dimension: " + name);
    }
}
