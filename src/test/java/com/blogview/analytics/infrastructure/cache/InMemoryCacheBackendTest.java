package com.blogview.analytics.infrastructure.cache;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryCacheBackendTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    private final InMemoryCacheBackend backend = new InMemoryCacheBackend(clock);

    @Test
    void testGetAndSet() {
        assertTrue(backend.get("analytics:grouped:abc").isEmpty());

        backend.set("analytics:grouped:abc", "[]", 900);

        assertEquals("[]", backend.get("analytics:grouped:abc").orElseThrow());
    }

    @Test
    void testPassiveExpiry() {
        backend.set("key", "value", 900);

        clock.advance(Duration.ofSeconds(899));
        assertTrue(backend.get("key").isPresent());

        clock.advance(Duration.ofSeconds(1));
        assertTrue(backend.get("key").isEmpty());
        assertEquals(0, backend.size());
    }

    @Test
    void testWriteSweepsExpiredKeysThatAreNeverRead() {
        for (int i = 0; i < 1000; i++) {
            backend.set("analytics:grouped:" + i, "[]", 900);
        }
        assertEquals(1000, backend.size());

        clock.advance(Duration.ofSeconds(900));
        backend.set("analytics:grouped:fresh", "[]", 900);

        assertEquals(1, backend.size());
        assertEquals("[]", backend.get("analytics:grouped:fresh").orElseThrow());
    }

    @Test
    void testSweepKeepsLiveEntries() {
        backend.set("short", "a", 10);
        backend.set("long", "b", 900);

        clock.advance(InMemoryCacheBackend.SWEEP_INTERVAL);
        backend.set("other", "c", 900);

        assertEquals(2, backend.size());
        assertTrue(backend.get("long").isPresent());
    }

    @Test
    void testOverwriteResetsTtl() {
        backend.set("key", "old", 10);
        clock.advance(Duration.ofSeconds(5));
        backend.set("key", "new", 10);
        clock.advance(Duration.ofSeconds(8));

        assertEquals("new", backend.get("key").orElseThrow());
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        private MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
