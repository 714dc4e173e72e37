package com.positionintel.intelligence.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory key → value store with per-entry TTL.
 *
 * <p>Expiry is enforced twice:
 * <ul>
 *   <li><b>Lazily</b>: {@link #get(String)} treats an expired entry as a miss and removes it</li>
 *   <li><b>Periodically</b>: once {@link #start()} is called, a Reactor interval sweeps every
 *       expired entry, so keys nobody re-reads still get released</li>
 * </ul>
 *
 * <p>Thread-safe via {@link ConcurrentHashMap}. Null payloads are rejected, so a failed
 * computation can never be stored as a cached value. The instance is owned by whoever
 * constructs it; {@link #close()} stops the sweeper.
 */
public class TtlCacheStore<V> implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TtlCacheStore.class);

    private static final int KEY_PREVIEW_LENGTH = 8;

    private final ConcurrentHashMap<String, CacheEntry<V>> store = new ConcurrentHashMap<>();
    private final AtomicLong hits   = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    private final Clock    clock;
    private final Duration defaultTtl;
    private final Duration sweepInterval;

    private Disposable sweeper;

    public TtlCacheStore(Clock clock, Duration defaultTtl, Duration sweepInterval) {
        if (defaultTtl.isNegative() || defaultTtl.isZero()) {
            throw new IllegalArgumentException("defaultTtl must be positive: " + defaultTtl);
        }
        if (sweepInterval.isNegative() || sweepInterval.isZero()) {
            throw new IllegalArgumentException("sweepInterval must be positive: " + sweepInterval);
        }
        this.clock         = clock;
        this.defaultTtl    = defaultTtl;
        this.sweepInterval = sweepInterval;
    }

    /**
     * Returns the cached payload, or {@code null} if absent or expired.
     * An expired entry is evicted on the way out.
     */
    public V get(String key) {
        CacheEntry<V> entry = store.get(key);
        if (entry == null) {
            misses.incrementAndGet();
            return null;
        }
        if (entry.isExpired(clock.instant())) {
            store.remove(key, entry);
            misses.incrementAndGet();
            log.debug("CACHE_EXPIRED key={}", preview(key));
            return null;
        }
        hits.incrementAndGet();
        return entry.payload();
    }

    /** Stores with the default TTL. */
    public void set(String key, V payload) {
        set(key, payload, defaultTtl);
    }

    /** Unconditionally overwrites any existing entry for {@code key}. */
    public void set(String key, V payload, Duration ttl) {
        if (payload == null) {
            throw new IllegalArgumentException("null payload for key " + key);
        }
        Duration actualTtl = ttl == null ? defaultTtl : ttl;
        store.put(key, new CacheEntry<>(key, payload, clock.instant(), actualTtl));
        log.info("CACHE_STORE key={} ttlSeconds={}", preview(key), actualTtl.toSeconds());
    }

    public boolean invalidate(String key) {
        return store.remove(key) != null;
    }

    /**
     * Removes every key containing {@code substring}.
     *
     * @return number of entries removed
     */
    public int invalidatePattern(String substring) {
        int removed = 0;
        for (String key : store.keySet()) {
            if (key.contains(substring) && store.remove(key) != null) {
                removed++;
            }
        }
        log.info("CACHE_INVALIDATE pattern={} removed={}", substring, removed);
        return removed;
    }

    /**
     * Removes every entry whose TTL has elapsed.
     *
     * @return number of entries removed
     */
    public int sweep() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<String, CacheEntry<V>> e : store.entrySet()) {
            if (e.getValue().isExpired(now) && store.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("CACHE_SWEEP removed={} size={}", removed, store.size());
        }
        return removed;
    }

    public void clear() {
        store.clear();
        log.info("CACHE_CLEAR");
    }

    /** Physical entry count, including expired entries not yet swept. */
    public int size() {
        return store.size();
    }

    public CacheStats stats() {
        List<String> previews = store.keySet().stream()
            .map(TtlCacheStore::preview)
            .sorted()
            .toList();
        return new CacheStats(store.size(), hits.get(), misses.get(), previews);
    }

    // ── sweeper lifecycle ───────────────────────────────────────────────────

    public synchronized void start() {
        if (sweeper != null && !sweeper.isDisposed()) {
            return;
        }
        sweeper = Flux.interval(sweepInterval, sweepInterval, Schedulers.parallel())
            .subscribe(
                tick -> sweep(),
                err -> log.error("Cache sweeper terminated", err));
        log.info("Cache sweeper started. intervalSeconds={} defaultTtlSeconds={}",
                 sweepInterval.toSeconds(), defaultTtl.toSeconds());
    }

    public synchronized boolean isSweeping() {
        return sweeper != null && !sweeper.isDisposed();
    }

    @Override
    public synchronized void close() {
        if (sweeper != null) {
            sweeper.dispose();
            sweeper = null;
            log.info("Cache sweeper stopped. size={}", store.size());
        }
    }

    /**
     * Drops the leading namespace segment and shortens the trailing segment (the digest, for
     * derived keys) to eight characters: {@code subject=u2:day=2024-01-01:4db37699...}.
     */
    static String preview(String key) {
        int namespaceEnd = key.indexOf(':');
        String rest = namespaceEnd < 0 ? key : key.substring(namespaceEnd + 1);
        int tailStart = rest.lastIndexOf(':') + 1;
        String tail = rest.substring(tailStart);
        return tail.length() <= KEY_PREVIEW_LENGTH
            ? rest
            : rest.substring(0, tailStart) + tail.substring(0, KEY_PREVIEW_LENGTH) + "...";
    }
}
