package com.blogview.analytics.api;

import com.blogview.analytics.domain.filter.FlatFilter;
import com.blogview.analytics.domain.mapper.FlatFilterMapper;
import com.blogview.analytics.domain.model.AnalyticsFilterRequest;
import com.blogview.analytics.domain.model.AnalyticsPoint;
import com.blogview.analytics.domain.model.ObjectType;
import com.blogview.analytics.domain.model.TopType;
import com.blogview.analytics.domain.service.AnalyticsService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for blog view analytics.
 *
 * Endpoints:
 * - POST /api/analytics/blog-views/{objectType} - Views grouped by country or user
 * - POST /api/analytics/blog-views/{objectType}/fast - Same grouping from daily summaries
 * - POST /api/analytics/top/{topType} - Top 10 blogs, users or countries
 * - POST /api/analytics/performance - Views over time with growth
 *
 * Request body (all fields optional):
 * {
 *   "range": "day|week|month|year",
 *   "start_date": "2024-01-01", "end_date": "2024-01-31T12:00:00Z",
 *   "year": 2024,
 *   "country_codes": ["US"], "exclude_country_codes": ["SPAM"],
 *   "author_username": "alice", "blog_id": 42,
 *   "filter": { "operator": "and", "conditions": [ ... ] }
 * }
 *
 * Response: [{"x": ..., "y": ..., "z": ...}, ...]
 */
@Slf4j
@RestController
@RequestMapping("/api/analytics")
@RequiredArgsConstructor
public class AnalyticsController {

    private final AnalyticsService analyticsService;
    private final FlatFilterMapper flatFilterMapper;

    @PostMapping("/blog-views/{objectType}")
    public ResponseEntity<List<AnalyticsPoint>> blogViews(
            @PathVariable String objectType,
            @Valid @RequestBody(required = false) AnalyticsFilterRequest request) {

        log.info("Grouped analytics: objectType={}", objectType);

        ObjectType type = ObjectType.fromCode(objectType);
        FlatFilter filter = flatFilterMapper.toFlatFilter(request);

        return ResponseEntity.ok(analyticsService.getGroupedAnalytics(type, filter));
    }

    /**
     * Reads pre-aggregated daily summaries; blog_id is ignored and filter expressions are rejected.
     */
    @PostMapping("/blog-views/{objectType}/fast")
    public ResponseEntity<List<AnalyticsPoint>> blogViewsFast(
            @PathVariable String objectType,
            @Valid @RequestBody(required = false) AnalyticsFilterRequest request) {

        log.info("Fast grouped analytics: objectType={}", objectType);

        ObjectType type = ObjectType.fromCode(objectType);
        FlatFilter filter = flatFilterMapper.toFlatFilter(request);

        return ResponseEntity.ok(analyticsService.getGroupedAnalyticsFast(type, filter));
    }

    @PostMapping("/top/{topType}")
    public ResponseEntity<List<AnalyticsPoint>> top(
            @PathVariable String topType,
            @Valid @RequestBody(required = false) AnalyticsFilterRequest request) {

        log.info("Top analytics: topType={}", topType);

        TopType type = TopType.fromCode(topType);
        FlatFilter filter = flatFilterMapper.toFlatFilter(request);

        return ResponseEntity.ok(analyticsService.getTopAnalytics(type, filter));
    }

    @PostMapping("/performance")
    public ResponseEntity<List<AnalyticsPoint>> performance(
            @Valid @RequestBody(required = false) AnalyticsFilterRequest request) {

        log.info("Performance analytics");

        FlatFilter filter = flatFilterMapper.toFlatFilter(request);

        return ResponseEntity.ok(analyticsService.getPerformanceAnalytics(filter));
    }
}
