package com.blogview.analytics.infrastructure.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Get-or-compute cache for analytics results.
 *
 * Caching Strategy:
 * - One fixed TTL (15 minutes) for every analytics operation
 * - No invalidation: new views show up once the entry expires
 *
 * A cache that cannot be read or written never fails the query: read failures are
 * a miss, write failures are logged and the computed result is returned anyway.
 */
@Slf4j
@Component
public class AnalyticsCache {

    public static final long DEFAULT_TTL_SECONDS = 900;

    private final CacheBackend backend;
    private final CacheKeyGenerator keyGenerator;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final long ttlSeconds;

    public AnalyticsCache(CacheBackend backend,
                          CacheKeyGenerator keyGenerator,
                          ObjectMapper objectMapper,
                          MeterRegistry meterRegistry,
                          @Value("${app.cache.ttl.analytics:900}") long ttlSeconds) {
        this.backend = backend;
        this.keyGenerator = keyGenerator;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
        this.ttlSeconds = ttlSeconds;
    }

    public <T> T getOrCompute(String operation, Object params, TypeReference<T> type, Supplier<T> compute) {
        String cacheKey = keyGenerator.generateKey(operation, params);

        Optional<T> cached = read(cacheKey, type);
        if (cached.isPresent()) {
            log.debug("Cache hit for key: {}", cacheKey);
            count("hit", operation);
            return cached.get();
        }

        log.debug("Cache miss for key: {}", cacheKey);
        count("miss", operation);

        T result = compute.get();
        write(cacheKey, result);
        return result;
    }

    private <T> Optional<T> read(String cacheKey, TypeReference<T> type) {
        Optional<String> payload;
        try {
            payload = backend.get(cacheKey);
        } catch (RuntimeException e) {
            log.error("Error reading from cache: {}", e.getMessage());
            count("error", "read");
            return Optional.empty();
        }
        if (payload.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(payload.get(), type));
        } catch (Exception e) {
            log.error("Discarding unreadable cache entry {}: {}", cacheKey, e.getMessage());
            count("error", "read");
            return Optional.empty();
        }
    }

    private void write(String cacheKey, Object value) {
        try {
            backend.set(cacheKey, objectMapper.writeValueAsString(value), ttlSeconds);
            log.debug("Cached result for key: {} (TTL: {}s)", cacheKey, ttlSeconds);
        } catch (Exception e) {
            // cache write failure shouldn't fail the query
            log.error("Error writing to cache: {}", e.getMessage());
            count("error", "write");
        }
    }

    private void count(String result, String operation) {
        Counter.builder("analytics.cache")
                .tag("result", result)
                .tag("operation", operation)
                .register(meterRegistry)
                .increment();
    }
}
