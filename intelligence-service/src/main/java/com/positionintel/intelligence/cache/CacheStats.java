package com.positionintel.intelligence.cache;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Point-in-time view of a {@link TtlCacheStore}. Key previews omit the namespace and
 * cut the digest to eight characters.
 */
public record CacheStats(
    @JsonProperty("size")        int          size,
    @JsonProperty("hits")        long         hits,
    @JsonProperty("misses")      long         misses,
    @JsonProperty("keyPreviews") List<String> keyPreviews
) {}
