package com.blogview.analytics.infrastructure.persistence.repository;

import com.blogview.analytics.infrastructure.persistence.entity.DailySummaryEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;

@Repository
public interface DailySummaryRepository extends JpaRepository<DailySummaryEntity, Long> {

    @Modifying
    @Query("DELETE FROM DailySummaryEntity s WHERE s.date >= :from")
    int deleteFromDate(@Param("from") LocalDate from);
}
