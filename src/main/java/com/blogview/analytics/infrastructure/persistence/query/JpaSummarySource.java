package com.blogview.analytics.infrastructure.persistence.query;

import com.blogview.analytics.domain.exception.InvalidDimensionException;
import com.blogview.analytics.domain.filter.FilterPredicate;
import com.blogview.analytics.domain.model.Dimension;
import com.blogview.analytics.domain.model.SummaryGroup;
import com.blogview.analytics.domain.source.SummarySource;
import com.blogview.analytics.infrastructure.persistence.entity.DailySummaryEntity;
import jakarta.persistence.EntityManager;
import jakarta.persistence.Tuple;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Root;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

/**
 * SUM aggregation over daily_analytics_summary.
 *
 * O(days x countries x authors) rows instead of O(views).
 */
@Repository
@RequiredArgsConstructor
public class JpaSummarySource implements SummarySource {

    private final EntityManager entityManager;

    @Override
    public List<SummaryGroup> groupBySummary(FilterPredicate predicate, Dimension dimension) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<Tuple> query = cb.createTupleQuery();
        Root<DailySummaryEntity> root = query.from(DailySummaryEntity.class);
        CriteriaPathResolver paths = new CriteriaPathResolver(root);

        Path<?> key = paths.resolve(dimensionPath(dimension));
        query.multiselect(key,
                        cb.sum(root.<Long>get("uniqueBlogs")),
                        cb.sum(root.<Long>get("totalViews")))
                .where(CriteriaPredicateBuilder.build(cb, paths, predicate))
                .groupBy(key);

        List<Tuple> rows = entityManager.createQuery(query).getResultList();
        List<SummaryGroup> groups = new ArrayList<>(rows.size());
        for (Tuple row : rows) {
            groups.add(new SummaryGroup(row.get(0, String.class),
                    nullToZero(row.get(1, Long.class)),
                    nullToZero(row.get(2, Long.class))));
        }
        return groups;
    }

    private static String dimensionPath(Dimension dimension) {
        switch (dimension) {
            case COUNTRY_CODE:
                return "country.code";
            case AUTHOR_USERNAME:
                return "author.username";
            default:
                throw new InvalidDimensionException("Summary rows cannot be grouped by " + dimension.getName());
        }
    }

    private static long nullToZero(Long value) {
        return value == null ? 0L : value;
    }
}
