package com.blogview.analytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Blog View Analytics
 *
 * Analytics backend over blog page-view events.
 *
 * Architecture:
 * - REST APIs for grouped, top-N and time-series analytics
 * - Dynamic filter expressions lowered to JPA criteria
 * - Redis caching of analytics results (15 minute TTL)
 * - Daily summary table as a fast path for grouped queries
 */
@SpringBootApplication
public class BlogViewAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(BlogViewAnalyticsApplication.class, args);
    }
}
