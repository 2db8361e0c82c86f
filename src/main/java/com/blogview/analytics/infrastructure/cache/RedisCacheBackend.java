package com.blogview.analytics.infrastructure.cache;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Redis-backed cache for analytics results.
 *
 * Why Redis?
 * - Shared across service instances
 * - TTL support (automatic eviction)
 * - SET replaces a value atomically, readers never see a partial payload
 *
 * Failure Handling:
 * - Circuit breaker stops hammering an unavailable Redis
 * - Fallbacks turn failures into a cache miss / skipped write
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.cache.backend", havingValue = "redis", matchIfMissing = true)
public class RedisCacheBackend implements CacheBackend {

    private final StringRedisTemplate redisTemplate;

    @Override
    @CircuitBreaker(name = "redis", fallbackMethod = "getCacheFallback")
    public Optional<String> get(String key) {
        return Optional.ofNullable(redisTemplate.opsForValue().get(key));
    }

    @Override
    @CircuitBreaker(name = "redis", fallbackMethod = "setCacheFallback")
    public void set(String key, String value, long ttlSeconds) {
        redisTemplate.opsForValue().set(key, value, ttlSeconds, TimeUnit.SECONDS);
    }

    // Fallback methods (circuit breaker)

    private Optional<String> getCacheFallback(String key, Exception e) {
        log.warn("Redis unavailable, treating {} as cache miss: {}", key, e.getMessage());
        return Optional.empty();
    }

    private void setCacheFallback(String key, String value, long ttlSeconds, Exception e) {
        log.warn("Redis unavailable, skipping cache write for {}: {}", key, e.getMessage());
    }
}
