package com.blogview.analytics.infrastructure.cache;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local cache backend for single-instance deployments and tests.
 *
 * An expired entry is dropped when it is next read. Writes also sweep all expired
 * entries, at most once per {@link #SWEEP_INTERVAL}, so keys that are never read again
 * do not accumulate.
 */
@Component
@ConditionalOnProperty(name = "app.cache.backend", havingValue = "memory")
public class InMemoryCacheBackend implements CacheBackend {

    static final Duration SWEEP_INTERVAL = Duration.ofSeconds(60);

    private final Clock clock;
    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private volatile Instant nextSweep = Instant.MIN;

    public InMemoryCacheBackend(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<String> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.expiresAt)) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value);
    }

    @Override
    public void set(String key, String value, long ttlSeconds) {
        Instant now = clock.instant();
        if (!now.isBefore(nextSweep)) {
            nextSweep = now.plus(SWEEP_INTERVAL);
            entries.values().removeIf(entry -> !now.isBefore(entry.expiresAt));
        }
        entries.put(key, new Entry(value, now.plusSeconds(ttlSeconds)));
    }

    int size() {
        return entries.size();
    }

    private static final class Entry {

        private final String value;
        private final Instant expiresAt;

        private Entry(String value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }
    }
}
