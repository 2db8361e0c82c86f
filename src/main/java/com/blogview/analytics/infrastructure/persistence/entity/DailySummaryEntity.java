package com.blogview.analytics.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDate;

/**
 * Pre-calculated daily aggregates per (date, country, author).
 *
 * One year of data is a few thousand rows instead of every view event.
 * Rows for a date range are replaced as a whole by {@code DailySummaryRollupService}.
 */
@Entity
@Table(name = "daily_analytics_summary",
    uniqueConstraints = @UniqueConstraint(name = "uk_summary_date_country_author",
        columnNames = {"summary_date", "country_id", "author_id"}),
    indexes = {
        @Index(name = "idx_summary_date_country", columnList = "summary_date,country_id"),
        @Index(name = "idx_summary_date_author", columnList = "summary_date,author_id")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailySummaryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "summary_date", nullable = false)
    private LocalDate date;

    @ToString.Exclude
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "country_id")
    private CountryEntity country;

    @ToString.Exclude
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "author_id")
    private UserEntity author;

    @Column(nullable = false)
    @Builder.Default
    private long totalViews = 0;

    @Column(nullable = false)
    @Builder.Default
    private long uniqueBlogs = 0;
}
