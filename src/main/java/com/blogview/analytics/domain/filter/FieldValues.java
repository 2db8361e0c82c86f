package com.blogview.analytics.domain.filter;

/**
 * A row whose fields can be read by dotted path, e.g. {@code blog.author.username}.
 */
@FunctionalInterface
public interface FieldValues {

    /**
     * @return the field value, or null when the path is empty for this row
     * @throws com.blogview.analytics.domain.exception.AnalyticsValidationException for an unknown path
     */
    Object valueOf(String path);
}
