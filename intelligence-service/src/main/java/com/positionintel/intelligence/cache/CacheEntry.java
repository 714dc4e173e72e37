package com.positionintel.intelligence.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable cache entry. Logically absent once {@code now > storedAt + ttl},
 * whether or not it has been swept yet.
 */
public record CacheEntry<V>(
    String key,
    V payload,
    Instant storedAt,
    Duration ttl
) {
    public boolean isExpired(Instant now) {
        return now.isAfter(storedAt.plus(ttl));
    }
}
