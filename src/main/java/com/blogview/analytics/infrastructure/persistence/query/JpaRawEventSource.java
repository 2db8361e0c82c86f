package com.blogview.analytics.infrastructure.persistence.query;

import com.blogview.analytics.domain.filter.FilterPredicate;
import com.blogview.analytics.domain.model.BucketWidth;
import com.blogview.analytics.domain.model.Dimension;
import com.blogview.analytics.domain.model.DistinctTarget;
import com.blogview.analytics.domain.model.GroupCount;
import com.blogview.analytics.domain.model.TimeBucketCount;
import com.blogview.analytics.domain.model.TimestampRange;
import com.blogview.analytics.domain.source.RawEventSource;
import com.blogview.analytics.infrastructure.persistence.entity.BlogViewEntity;
import jakarta.persistence.EntityManager;
import jakarta.persistence.Tuple;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Root;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Criteria-API queries over blog_views.
 *
 * Counting, grouping and min/max run in the database. Time bucketing streams the
 * (timestamp, blog) projection and folds it per bucket here, which keeps calendar
 * truncation independent of the database dialect.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class JpaRawEventSource implements RawEventSource {

    private final EntityManager entityManager;

    @Override
    public long count(FilterPredicate predicate) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<Long> query = cb.createQuery(Long.class);
        Root<BlogViewEntity> root = query.from(BlogViewEntity.class);
        CriteriaPathResolver paths = new CriteriaPathResolver(root);

        query.select(cb.count(root))
                .where(CriteriaPredicateBuilder.build(cb, paths, predicate));
        return entityManager.createQuery(query).getSingleResult();
    }

    @Override
    public long countDistinct(FilterPredicate predicate, Dimension dimension) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<Long> query = cb.createQuery(Long.class);
        Root<BlogViewEntity> root = query.from(BlogViewEntity.class);
        CriteriaPathResolver paths = new CriteriaPathResolver(root);

        query.select(cb.countDistinct(paths.resolve(dimensionPath(dimension))))
                .where(CriteriaPredicateBuilder.build(cb, paths, predicate));
        return entityManager.createQuery(query).getSingleResult();
    }

    @Override
    public List<GroupCount> groupBy(FilterPredicate predicate, Dimension dimension, DistinctTarget distinctOf) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<Tuple> query = cb.createTupleQuery();
        Root<BlogViewEntity> root = query.from(BlogViewEntity.class);
        CriteriaPathResolver paths = new CriteriaPathResolver(root);

        Path<?> key = paths.resolve(dimensionPath(dimension));
        Path<?> distinct = paths.resolve(distinctPath(distinctOf));
        query.multiselect(key, cb.count(root), cb.countDistinct(distinct))
                .where(CriteriaPredicateBuilder.build(cb, paths, predicate))
                .groupBy(key);

        List<Tuple> rows = entityManager.createQuery(query).getResultList();
        List<GroupCount> groups = new ArrayList<>(rows.size());
        for (Tuple row : rows) {
            groups.add(new GroupCount(row.get(0, String.class), row.get(1, Long.class), row.get(2, Long.class)));
        }
        log.debug("Grouped views by {}: {} groups", dimension.getName(), groups.size());
        return groups;
    }

    @Override
    public List<TimeBucketCount> timeBucketed(FilterPredicate predicate, BucketWidth width, ZoneId zone) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<Tuple> query = cb.createTupleQuery();
        Root<BlogViewEntity> root = query.from(BlogViewEntity.class);
        CriteriaPathResolver paths = new CriteriaPathResolver(root);

        query.multiselect(root.get("timestamp"), paths.resolve("blog.id"))
                .where(CriteriaPredicateBuilder.build(cb, paths, predicate));

        Map<LocalDate, BucketAccumulator> buckets = new TreeMap<>();
        try (Stream<Tuple> rows = entityManager.createQuery(query).getResultStream()) {
            rows.forEach(row -> {
                LocalDate day = LocalDate.ofInstant(row.get(0, Instant.class), zone);
                buckets.computeIfAbsent(width.truncate(day), start -> new BucketAccumulator())
                        .add(row.get(1, Long.class));
            });
        }

        List<TimeBucketCount> series = new ArrayList<>(buckets.size());
        buckets.forEach((start, bucket) -> series.add(new TimeBucketCount(start, bucket.views, bucket.blogs.size())));
        return series;
    }

    @Override
    public Optional<TimestampRange> minMaxTimestamp(FilterPredicate predicate) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<Tuple> query = cb.createTupleQuery();
        Root<BlogViewEntity> root = query.from(BlogViewEntity.class);
        CriteriaPathResolver paths = new CriteriaPathResolver(root);

        Path<Instant> timestamp = root.get("timestamp");
        query.multiselect(cb.least(timestamp), cb.greatest(timestamp))
                .where(CriteriaPredicateBuilder.build(cb, paths, predicate));

        Tuple row = entityManager.createQuery(query).getSingleResult();
        Instant min = row.get(0, Instant.class);
        if (min == null) {
            return Optional.empty();
        }
        return Optional.of(new TimestampRange(min, row.get(1, Instant.class)));
    }

    static String dimensionPath(Dimension dimension) {
        switch (dimension) {
            case COUNTRY_CODE:
                return "country.code";
            case AUTHOR_USERNAME:
                return "blog.author.username";
            case BLOG_TITLE:
                return "blog.title";
            default:
                throw new IllegalStateException("Unmapped dimension: " + dimension);
        }
    }

    private static String distinctPath(DistinctTarget target) {
        return target == DistinctTarget.COUNTRIES ? "country.id" : "blog.id";
    }

    private static final class BucketAccumulator {

        private long views;
        private final Set<Long> blogs = new HashSet<>();

        void add(Long blogId) {
            views++;
            blogs.add(blogId);
        }
    }
}
