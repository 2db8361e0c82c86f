package com.blogview.analytics.infrastructure.persistence.repository;

import com.blogview.analytics.infrastructure.persistence.entity.BlogViewEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Repository for raw blog views.
 *
 * Filtered analytics go through {@code JpaRawEventSource}; this repository only serves
 * the daily rollup.
 */
@Repository
public interface BlogViewRepository extends JpaRepository<BlogViewEntity, Long> {

    @Query("SELECT MIN(v.timestamp) FROM BlogViewEntity v")
    Optional<Instant> findEarliestTimestamp();

    /**
     * Rollup projection: [timestamp, countryId, authorId, blogId] for every view since {@code from}.
     *
     * Must be consumed inside a transaction and closed.
     */
    @Query("SELECT v.timestamp, c.id, a.id, b.id FROM BlogViewEntity v " +
           "JOIN v.blog b " +
           "JOIN b.author a " +
           "LEFT JOIN v.country c " +
           "WHERE v.timestamp >= :from")
    Stream<Object[]> streamRollupRows(@Param("from") Instant from);
}
