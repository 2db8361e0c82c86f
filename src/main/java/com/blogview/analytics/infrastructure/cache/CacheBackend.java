package com.blogview.analytics.infrastructure.cache;

import java.util.Optional;

/**
 * Key-value store holding serialized analytics results.
 *
 * Implementations must make get and set atomic per key: a reader sees either the
 * previous value or the complete new one. Failures may be thrown; callers treat them
 * as a cache miss.
 */
public interface CacheBackend {

    Optional<String> get(String key);

    void set(String key, String value, long ttlSeconds);
}
