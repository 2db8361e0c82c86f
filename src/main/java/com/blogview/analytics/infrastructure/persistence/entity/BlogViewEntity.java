package com.blogview.analytics.infrastructure.persistence.entity;

import com.blogview.analytics.domain.exception.AnalyticsValidationException;
import com.blogview.analytics.domain.filter.FieldValues;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * Fact table for analytics: one row per blog view.
 *
 * Rows are written by the ingestion path and never updated.
 *
 * Indexing Strategy:
 * - Composite index on (timestamp, country) for time range + country filters
 * - Composite index on (blog, timestamp) for per-blog queries
 */
@Entity
@Table(name = "blog_views", indexes = {
    @Index(name = "idx_view_timestamp_country", columnList = "viewed_at,country_id"),
    @Index(name = "idx_view_blog_timestamp", columnList = "blog_id,viewed_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BlogViewEntity implements FieldValues {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ToString.Exclude
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "blog_id", nullable = false)
    private BlogEntity blog;

    @ToString.Exclude
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "country_id")
    private CountryEntity country;

    @Column(length = 45)
    private String ipAddress;

    @ToString.Exclude
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "viewer_id")
    private UserEntity viewer;

    @Column(name = "viewed_at", nullable = false)
    private Instant timestamp;

    @PrePersist
    protected void onCreate() {
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    /**
     * Reads a filterable field by the same dotted path the JPA criteria use.
     */
    @Override
    public Object valueOf(String path) {
        switch (path) {
            case "id":
                return id;
            case "timestamp":
                return timestamp;
            case "ipAddress":
                return ipAddress;
            case "blog.id":
                return blog.getId();
            case "blog.title":
                return blog.getTitle();
            case "blog.createdAt":
                return blog.getCreatedAt();
            case "blog.author.id":
                return blog.getAuthor().getId();
            case "blog.author.username":
                return blog.getAuthor().getUsername();
            case "country.id":
                return country == null ? null : country.getId();
            case "country.code":
                return country == null ? null : country.getCode();
            case "country.name":
                return country == null ? null : country.getName();
            case "viewer.id":
                return viewer == null ? null : viewer.getId();
            case "viewer.username":
                return viewer == null ? null : viewer.getUsername();
            default:
                throw new AnalyticsValidationException("Unknown filter field: " + path);
        }
    }
}
