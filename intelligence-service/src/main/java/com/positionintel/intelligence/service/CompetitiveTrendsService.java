package com.positionintel.intelligence.service;

import com.positionintel.common.exception.ProviderUnavailableException;
import com.positionintel.common.key.CacheKeyDeriver;
import com.positionintel.common.model.CompetitiveTrends;
import com.positionintel.common.model.MetricQuery;
import com.positionintel.common.model.ObservationRecord;
import com.positionintel.common.position.TrendCalculator;
import com.positionintel.intelligence.cache.TtlCacheStore;
import com.positionintel.intelligence.coordination.SingleFlightCoordinator;
import com.positionintel.intelligence.provider.PricingObservationSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

/**
 * Daily pricing trends for a subject's market, cached under the
 * {@link CacheKeyDeriver#TRENDS_NAMESPACE} key family and single-flighted like positions.
 *
 * <p>There is no fallback tier for trends. A pricing source that fails or exceeds the
 * provider timeout surfaces as {@link ProviderUnavailableException} and nothing is cached.
 * A zero-day window yields empty trends without querying the source.
 */
public class CompetitiveTrendsService {

    private static final Logger log = LoggerFactory.getLogger(CompetitiveTrendsService.class);

    private final TtlCacheStore<CompetitiveTrends> cache;
    private final SingleFlightCoordinator singleFlight;
    private final PricingObservationSource pricing;
    private final CacheKeyDeriver keyDeriver;
    private final Clock clock;
    private final Duration trendsTtl;
    private final Duration providerTimeout;
    private final QueryValidator validator;

    public CompetitiveTrendsService(TtlCacheStore<CompetitiveTrends> cache,
                                    SingleFlightCoordinator singleFlight,
                                    PricingObservationSource pricing,
                                    CacheKeyDeriver keyDeriver,
                                    Clock clock,
                                    Duration trendsTtl,
                                    Duration providerTimeout,
                                    int maxWindowDays) {
        this.cache           = cache;
        this.singleFlight    = singleFlight;
        this.pricing         = pricing;
        this.keyDeriver      = keyDeriver;
        this.clock           = clock;
        this.trendsTtl       = trendsTtl;
        this.providerTimeout = providerTimeout;
        this.validator       = new QueryValidator(maxWindowDays);
    }

    public Mono<CompetitiveTrends> computeTrends(String subjectId, int windowDays) {
        return Mono.defer(() -> {
            validator.validate(subjectId, windowDays);
            MetricQuery query = MetricQuery.of(subjectId, windowDays, LocalDate.now(clock));
            String key = keyDeriver.deriveTrends(query);

            CompetitiveTrends cached = cache.get(key);
            if (cached != null) {
                log.info("CACHE_HIT family=trends subject={} windowDays={} points={}",
                         query.normalizedSubject(), windowDays, cached.points().size());
                return Mono.just(cached);
            }
            log.info("CACHE_MISS family=trends subject={} windowDays={}", query.normalizedSubject(), windowDays);

            return singleFlight.resolve(key, () -> {
                CompetitiveTrends settled = cache.get(key);
                return settled != null ? Mono.just(settled) : compute(query, key);
            });
        });
    }

    public TtlCacheStore<CompetitiveTrends> cache() {
        return cache;
    }

    private Mono<CompetitiveTrends> compute(MetricQuery query, String key) {
        String subject = query.normalizedSubject();
        LocalDate from = query.windowStart();
        LocalDate to   = query.asOf();

        return observe(subject, from, to, query.windowDays())
            .map(records -> TrendCalculator.trends(subject, from, to, records))
            .doOnNext(trends -> {
                cache.set(key, trends, trendsTtl);
                log.info("TRENDS_COMPUTED subject={} windowDays={} points={}",
                         subject, query.windowDays(), trends.points().size());
            });
    }

    private Mono<List<ObservationRecord>> observe(String subject, LocalDate from, LocalDate to, int windowDays) {
        if (windowDays == 0) {
            return Mono.just(List.of());
        }
        return Mono.defer(() -> pricing.query(subject, from, to))
            .timeout(providerTimeout)
            .defaultIfEmpty(List.of())
            .onErrorMap(e -> !(e instanceof ProviderUnavailableException),
                        e -> new ProviderUnavailableException(pricing.providerId(), subject, e))
            .doOnError(e -> log.warn("PROVIDER_UNAVAILABLE provider={} subject={} family=trends reason={}",
                                     pricing.providerId(), subject, e.getMessage()));
    }
}
