package com.positionintel.intelligence.cache;

import com.positionintel.intelligence.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TtlCacheStoreTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    private final TtlCacheStore<String> cache =
        new TtlCacheStore<>(clock, Duration.ofMinutes(30), Duration.ofMinutes(5));

    @AfterEach
    void tearDown() {
        cache.close();
    }

    // ── get / set ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("get() / set()")
    class GetSetTests {

        @Test
        @DisplayName("set then get returns the value")
        void roundTrip() {
            cache.set("k", "v", Duration.ofMinutes(1));

            assertEquals("v", cache.get("k"));
        }

        @Test
        @DisplayName("1ms TTL entry is absent 5ms later on the system clock")
        void expiresOnSystemClock() throws InterruptedException {
            try (TtlCacheStore<String> real =
                     new TtlCacheStore<>(Clock.systemUTC(), Duration.ofMinutes(30), Duration.ofMinutes(5))) {
                real.set("k", "v", Duration.ofMillis(1));
                Thread.sleep(5);

                assertNull(real.get("k"));
            }
        }

        @Test
        @DisplayName("expired entry is removed by get(), not only by the sweeper")
        void lazyEviction() {
            cache.set("k", "v", Duration.ofMinutes(1));
            clock.advance(Duration.ofMinutes(2));

            assertEquals(1, cache.size());
            assertNull(cache.get("k"));
            assertEquals(0, cache.size());
        }

        @Test
        @DisplayName("entry is still present exactly at storedAt + ttl")
        void boundaryInclusive() {
            cache.set("k", "v", Duration.ofMinutes(1));
            clock.advance(Duration.ofMinutes(1));

            assertEquals("v", cache.get("k"));
        }

        @Test
        @DisplayName("default TTL applies when none supplied")
        void defaultTtl() {
            cache.set("k", "v");
            clock.advance(Duration.ofMinutes(29));
            assertEquals("v", cache.get("k"));

            clock.advance(Duration.ofMinutes(2));
            assertNull(cache.get("k"));
        }

        @Test
        @DisplayName("set overwrites value and restarts TTL")
        void overwrite() {
            cache.set("k", "old", Duration.ofMinutes(1));
            clock.advance(Duration.ofSeconds(50));
            cache.set("k", "new", Duration.ofMinutes(1));
            clock.advance(Duration.ofSeconds(50));

            assertEquals("new", cache.get("k"));
        }

        @Test
        @DisplayName("null payload is rejected")
        void nullRejected() {
            assertThrows(IllegalArgumentException.class, () -> cache.set("k", null));
            assertEquals(0, cache.size());
        }

        @Test
        @DisplayName("non-positive durations rejected at construction")
        void invalidConstruction() {
            assertThrows(IllegalArgumentException.class,
                () -> new TtlCacheStore<String>(clock, Duration.ZERO, Duration.ofMinutes(5)));
            assertThrows(IllegalArgumentException.class,
                () -> new TtlCacheStore<String>(clock, Duration.ofMinutes(5), Duration.ofSeconds(-1)));
        }
    }

    // ── invalidation ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("invalidatePattern()")
    class InvalidationTests {

        @Test
        @DisplayName("removes only keys containing the substring")
        void scope() {
            cache.set("position:day=2024-01-01:a", "1");
            cache.set("position:day=2024-01-01:b", "2");
            cache.set("position:day=2024-01-02:a", "3");
            cache.set("briefing", "4");

            assertEquals(2, cache.invalidatePattern("2024-01-01"));
            assertNull(cache.get("position:day=2024-01-01:a"));
            assertNull(cache.get("position:day=2024-01-01:b"));
            assertEquals("3", cache.get("position:day=2024-01-02:a"));
            assertEquals("4", cache.get("briefing"));
        }

        @Test
        @DisplayName("no match → zero removed")
        void noMatch() {
            cache.set("a", "1");

            assertEquals(0, cache.invalidatePattern("zzz"));
            assertEquals(1, cache.size());
        }

        @Test
        @DisplayName("invalidate() and clear()")
        void singleAndClear() {
            cache.set("a", "1");
            cache.set("b", "2");

            assertTrue(cache.invalidate("a"));
            assertFalse(cache.invalidate("a"));
            cache.clear();
            assertEquals(0, cache.size());
        }
    }

    // ── sweeping ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("sweep()")
    class SweepTests {

        @Test
        @DisplayName("removes expired entries nobody reads, keeps live ones")
        void sweepExpired() {
            cache.set("short", "1", Duration.ofMinutes(1));
            cache.set("long", "2", Duration.ofMinutes(10));
            clock.advance(Duration.ofMinutes(5));

            assertEquals(1, cache.sweep());
            assertEquals(1, cache.size());
            assertEquals("2", cache.get("long"));
        }

        @Test
        @DisplayName("start() sweeps on the interval without any reads; close() stops it")
        void backgroundSweep() throws InterruptedException {
            try (TtlCacheStore<String> swept =
                     new TtlCacheStore<>(clock, Duration.ofMinutes(30), Duration.ofMillis(20))) {
                swept.set("k", "v", Duration.ofMinutes(1));
                clock.advance(Duration.ofMinutes(2));
                swept.start();
                assertTrue(swept.isSweeping());

                long deadline = System.currentTimeMillis() + 2_000;
                while (swept.size() > 0 && System.currentTimeMillis() < deadline) {
                    Thread.sleep(10);
                }
                assertEquals(0, swept.size());

                swept.close();
                assertFalse(swept.isSweeping());
            }
        }
    }

    // ── stats ─────────────────────────────────────────────────────────────

    @Test
    @DisplayName("stats() counts hits and misses and previews keys without the namespace")
    void stats() {
        cache.set("competitive-position:abc", "v");
        cache.get("competitive-position:abc");
        cache.get("missing");

        CacheStats stats = cache.stats();
        assertEquals(1, stats.size());
        assertEquals(1, stats.hits());
        assertEquals(1, stats.misses());
        assertEquals("abc", stats.keyPreviews().get(0));
    }

    @Test
    @DisplayName("key preview keeps the readable prefix and cuts the digest")
    void keyPreview() {
        String digest = "4db37699" + "0".repeat(56);

        assertEquals("subject=u2:day=2024-01-01:4db37699...",
            TtlCacheStore.preview("competitive-position:subject=u2:day=2024-01-01:" + digest));
        assertEquals("subject=u2:day=2024-01-01:4db37699...",
            TtlCacheStore.preview("competitive-trends:subject=u2:day=2024-01-01:" + digest));
        assertEquals("plainkey", TtlCacheStore.preview("plainkey"));
        assertEquals("a-much-l...", TtlCacheStore.preview("a-much-longer-plain-key"));
    }
}
