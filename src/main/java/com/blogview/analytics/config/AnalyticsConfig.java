package com.blogview.analytics.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(AnalyticsProperties.class)
public class AnalyticsConfig {

    /**
     * Source of "now" for relative range filters and in-memory cache expiry.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
