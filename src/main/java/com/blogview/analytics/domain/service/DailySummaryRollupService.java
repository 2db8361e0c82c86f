package com.blogview.analytics.domain.service;

import com.blogview.analytics.config.AnalyticsProperties;
import com.blogview.analytics.infrastructure.persistence.entity.CountryEntity;
import com.blogview.analytics.infrastructure.persistence.entity.DailySummaryEntity;
import com.blogview.analytics.infrastructure.persistence.entity.UserEntity;
import com.blogview.analytics.infrastructure.persistence.repository.BlogViewRepository;
import com.blogview.analytics.infrastructure.persistence.repository.DailySummaryRepository;
import jakarta.persistence.EntityManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Rebuilds daily_analytics_summary from raw views.
 *
 * Rollup Flow:
 * 1. Delete summaries on or after the start date
 * 2. Stream views since the start date
 * 3. Aggregate per (date, country, author): views and distinct blogs
 * 4. Bulk insert
 *
 * Runs in one transaction, readers never observe a half-rebuilt range.
 * Nothing schedules this; callers decide when to run it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DailySummaryRollupService {

    private final BlogViewRepository blogViewRepository;
    private final DailySummaryRepository dailySummaryRepository;
    private final EntityManager entityManager;
    private final AnalyticsProperties properties;

    /**
     * @param from first day to rebuild, or {@code null} to rebuild from the earliest view
     * @return number of summary rows created
     */
    @Transactional
    public int rebuild(LocalDate from) {
        ZoneId zone = properties.getTimeZone();
        LocalDate startDate = from;
        if (startDate == null) {
            Optional<Instant> earliest = blogViewRepository.findEarliestTimestamp();
            if (earliest.isEmpty()) {
                log.info("No blog views recorded, nothing to roll up");
                return 0;
            }
            startDate = LocalDate.ofInstant(earliest.get(), zone);
        }

        long startTime = System.currentTimeMillis();
        int deleted = dailySummaryRepository.deleteFromDate(startDate);

        Map<SummaryKey, SummaryAccumulator> groups = new HashMap<>();
        try (Stream<Object[]> rows = blogViewRepository.streamRollupRows(startDate.atStartOfDay(zone).toInstant())) {
            rows.forEach(row -> {
                SummaryKey key = new SummaryKey(
                        LocalDate.ofInstant((Instant) row[0], zone),
                        (Long) row[1],
                        (Long) row[2]);
                groups.computeIfAbsent(key, k -> new SummaryAccumulator()).add((Long) row[3]);
            });
        }

        List<DailySummaryEntity> summaries = new ArrayList<>(groups.size());
        groups.forEach((key, totals) -> summaries.add(DailySummaryEntity.builder()
                .date(key.date)
                .country(key.countryId == null ? null : entityManager.getReference(CountryEntity.class, key.countryId))
                .author(key.authorId == null ? null : entityManager.getReference(UserEntity.class, key.authorId))
                .totalViews(totals.views)
                .uniqueBlogs(totals.blogs.size())
                .build()));
        dailySummaryRepository.saveAll(summaries);

        log.info("Daily summaries rebuilt from {}: {} deleted, {} created, {} ms",
                startDate, deleted, summaries.size(), System.currentTimeMillis() - startTime);
        return summaries.size();
    }

    private static final class SummaryKey {

        private final LocalDate date;
        private final Long countryId;
        private final Long authorId;

        private SummaryKey(LocalDate date, Long countryId, Long authorId) {
            this.date = date;
            this.countryId = countryId;
            this.authorId = authorId;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof SummaryKey)) {
                return false;
            }
            SummaryKey other = (SummaryKey) o;
            return date.equals(other.date)
                    && Objects.equals(countryId, other.countryId)
                    && Objects.equals(authorId, other.authorId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(date, countryId, authorId);
        }
    }

    private static final class SummaryAccumulator {

        private long views;
        private final Set<Long> blogs = new HashSet<>();

        void add(Long blogId) {
            views++;
            blogs.add(blogId);
        }
    }
}
