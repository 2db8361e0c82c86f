package com.blogview.analytics.domain.filter;

/**
 * Field paths of the flat filter on each backing dataset.
 */
public enum FilterTarget {

    /** blog_views rows, datetime semantics. */
    RAW_EVENTS("timestamp", "country.code", "blog.author.username", "blog.id", false),

    /** daily_analytics_summary rows, date-only semantics and no blog column. */
    DAILY_SUMMARY("date", "country.code", "author.username", null, true);

    private final String timeField;
    private final String countryCodeField;
    private final String authorField;
    private final String blogIdField;
    private final boolean dateOnly;

    FilterTarget(String timeField, String countryCodeField, String authorField, String blogIdField, boolean dateOnly) {
        this.timeField = timeField;
        this.countryCodeField = countryCodeField;
        this.authorField = authorField;
        this.blogIdField = blogIdField;
        this.dateOnly = dateOnly;
    }

    public String getTimeField() {
        return timeField;
    }

    public String getCountryCodeField() {
        return countryCodeField;
    }

    public String getAuthorField() {
        return authorField;
    }

    public String getBlogIdField() {
        return blogIdField;
    }

    public boolean isDateOnly() {
        return dateOnly;
    }

    public boolean supportsBlogFilter() {
        return blogIdField != null;
    }
}
