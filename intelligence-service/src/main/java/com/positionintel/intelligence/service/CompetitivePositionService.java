package com.positionintel.intelligence.service;

import com.positionintel.common.exception.SubjectNotFoundException;
import com.positionintel.common.key.CacheKeyDeriver;
import com.positionintel.common.model.CompetitivePosition;
import com.positionintel.common.model.MetricQuery;
import com.positionintel.common.model.NetworkSummary;
import com.positionintel.intelligence.cache.TtlCacheStore;
import com.positionintel.intelligence.cascade.FallbackCascade;
import com.positionintel.intelligence.coordination.SingleFlightCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

/**
 * Entry point for competitive position lookups. Results are cached and single-flighted.
 *
 * <p><strong>Flow:</strong>
 * <ol>
 *   <li>Validate the request; malformed input fails immediately and is never cached.</li>
 *   <li>Derive the cache key and check {@link TtlCacheStore}; a hit returns immediately.</li>
 *   <li>On miss, {@link SingleFlightCoordinator} ensures one {@link FallbackCascade} run per key;
 *       every concurrent caller receives the same result.</li>
 *   <li>The result is stored with the position TTL before waiters are released.</li>
 * </ol>
 *
 * <p>A computation exceeding the overall timeout yields an uncached BASELINE result.
 * {@code forceRefresh} skips the lookup and invalidates every cached key for the subject.
 */
public class CompetitivePositionService {

    private static final Logger log = LoggerFactory.getLogger(CompetitivePositionService.class);

    private final TtlCacheStore<CompetitivePosition> cache;
    private final SingleFlightCoordinator singleFlight;
    private final FallbackCascade cascade;
    private final CacheKeyDeriver keyDeriver;
    private final Clock clock;
    private final Duration positionTtl;
    private final Duration computeTimeout;
    private final QueryValidator validator;

    public CompetitivePositionService(TtlCacheStore<CompetitivePosition> cache,
                                      SingleFlightCoordinator singleFlight,
                                      FallbackCascade cascade,
                                      CacheKeyDeriver keyDeriver,
                                      Clock clock,
                                      Duration positionTtl,
                                      Duration computeTimeout,
                                      int maxWindowDays) {
        this.cache          = cache;
        this.singleFlight   = singleFlight;
        this.cascade        = cascade;
        this.keyDeriver     = keyDeriver;
        this.clock          = clock;
        this.positionTtl    = positionTtl;
        this.computeTimeout = computeTimeout;
        this.validator      = new QueryValidator(maxWindowDays);
    }

    public Mono<CompetitivePosition> computePosition(String subjectId, int windowDays) {
        return computePosition(subjectId, windowDays, false);
    }

    public Mono<CompetitivePosition> computePosition(String subjectId, int windowDays, boolean forceRefresh) {
        return Mono.defer(() -> {
            validator.validate(subjectId, windowDays);
            MetricQuery query = MetricQuery.of(subjectId, windowDays, LocalDate.now(clock));
            String key = keyDeriver.derive(query);

            if (forceRefresh) {
                cache.invalidatePattern(CacheKeyDeriver.subjectPattern(subjectId));
                log.info("FORCE_REFRESH subject={} windowDays={}", query.normalizedSubject(), windowDays);
            } else {
                CompetitivePosition cached = cache.get(key);
                if (cached != null) {
                    log.info("CACHE_HIT subject={} windowDays={} tier={}",
                             query.normalizedSubject(), windowDays, cached.tier());
                    return Mono.just(cached);
                }
                log.info("CACHE_MISS subject={} windowDays={}", query.normalizedSubject(), windowDays);
            }

            return singleFlight.resolve(key, () -> {
                CompetitivePosition settled = forceRefresh ? null : cache.get(key);
                return settled != null ? Mono.just(settled) : compute(query, key);
            });
        });
    }

    /**
     * Positions for every subject, computed in parallel through {@link #computePosition}.
     * Subjects with neither observations nor a baseline are left out of {@code positions}
     * but still count towards {@code totalSubjects}.
     */
    public Mono<NetworkSummary> summarizeNetwork(List<String> subjectIds, int windowDays) {
        return Flux.fromIterable(subjectIds)
            .flatMapSequential(subjectId -> computePosition(subjectId, windowDays)
                .onErrorResume(SubjectNotFoundException.class, e -> {
                    log.info("Network summary skipping subject={} reason={}", subjectId, e.getMessage());
                    return Mono.empty();
                }))
            .collectList()
            .map(positions -> NetworkSummary.from(subjectIds.size(), positions))
            .doOnNext(summary -> log.info("Network summary built. subjects={} withData={} avgCompetitors={}",
                summary.totalSubjects(), summary.subjectsWithData(), summary.avgCompetitorCount()));
    }

    public TtlCacheStore<CompetitivePosition> cache() {
        return cache;
    }

    // ── internals ─────────────────────────────────────────────────────────────

    private Mono<CompetitivePosition> compute(MetricQuery query, String key) {
        return cascade.resolve(query)
            .doOnNext(position -> cache.set(key, position, positionTtl))
            .timeout(computeTimeout, Mono.defer(() -> {
                log.warn("COMPUTE_TIMEOUT subject={} windowDays={} timeoutMs={} fallback=uncached-baseline",
                         query.normalizedSubject(), query.windowDays(), computeTimeout.toMillis());
                return cascade.baseline(query.normalizedSubject());
            }));
    }
}
