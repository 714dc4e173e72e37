package com.positionintel.intelligence.cascade;

import com.positionintel.common.exception.ProviderUnavailableException;
import com.positionintel.common.exception.SubjectNotFoundException;
import com.positionintel.common.model.BaselineDefaults;
import com.positionintel.common.model.CompetitivePosition;
import com.positionintel.common.model.MetricQuery;
import com.positionintel.common.model.ObservationRecord;
import com.positionintel.common.position.PositionCalculator;
import com.positionintel.intelligence.provider.CapacityObservationSource;
import com.positionintel.intelligence.provider.ObservationSource;
import com.positionintel.intelligence.provider.PricingObservationSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

/**
 * Resolves a {@link CompetitivePosition} from the best data tier available.
 *
 * <p><strong>Flow:</strong>
 * <ol>
 *   <li>Query pricing and capacity sources in parallel for {@code [asOf - windowDays, asOf]}.</li>
 *   <li>A source that fails or exceeds the provider timeout contributes nothing;
 *       the failure is logged and the result degrades a tier instead of erroring.</li>
 *   <li>{@link PositionCalculator} computes the MEASURED or PARTIAL position.</li>
 *   <li>If neither half resolves, the configured {@link BaselineDefaults} supply a BASELINE
 *       result; a subject with no baseline is reported as {@link SubjectNotFoundException}.</li>
 * </ol>
 *
 * <p>A zero-day window skips the sources and goes straight to the baseline.
 */
public class FallbackCascade {

    private static final Logger log = LoggerFactory.getLogger(FallbackCascade.class);

    private final PricingObservationSource  pricing;
    private final CapacityObservationSource capacity;
    private final BaselineDefaults          baselines;
    private final Duration                  providerTimeout;

    public FallbackCascade(PricingObservationSource pricing,
                           CapacityObservationSource capacity,
                           BaselineDefaults baselines,
                           Duration providerTimeout) {
        this.pricing         = pricing;
        this.capacity        = capacity;
        this.baselines       = baselines;
        this.providerTimeout = providerTimeout;
    }

    public Mono<CompetitivePosition> resolve(MetricQuery query) {
        String subject = query.normalizedSubject();
        if (query.windowDays() == 0) {
            log.info("TIER_SELECTED subject={} tier=BASELINE reason=empty-window", subject);
            return baseline(subject);
        }

        LocalDate from = query.windowStart();
        LocalDate to   = query.asOf();

        return Mono.zip(fetch(pricing, subject, from, to), fetch(capacity, subject, from, to))
            .flatMap(observed -> PositionCalculator.calculate(subject, observed.getT1(), observed.getT2())
                .map(Mono::just)
                .orElseGet(() -> baseline(subject)))
            .doOnNext(position -> log.info(
                "TIER_SELECTED subject={} windowDays={} tier={} pricing={} capacity={} competitors={}",
                subject, query.windowDays(), position.tier(),
                position.hasPricing(), position.hasCapacity(), position.competitorCount()));
    }

    /** BASELINE result for the subject, or {@link SubjectNotFoundException} if none is configured. */
    public Mono<CompetitivePosition> baseline(String subjectId) {
        return Mono.defer(() -> baselines.forSubject(subjectId)
            .map(reference -> Mono.just(PositionCalculator.baseline(subjectId, reference)))
            .orElseGet(() -> Mono.error(new SubjectNotFoundException(subjectId))));
    }

    private Mono<List<ObservationRecord>> fetch(ObservationSource source, String subject,
                                                LocalDate from, LocalDate to) {
        return Mono.defer(() -> source.query(subject, from, to))
            .timeout(providerTimeout)
            .map(records -> records.stream()
                .filter(r -> r.isWithin(from, to))
                .toList())
            .defaultIfEmpty(List.of())
            .onErrorResume(e -> {
                ProviderUnavailableException unavailable =
                    new ProviderUnavailableException(source.providerId(), subject, e);
                log.warn("PROVIDER_UNAVAILABLE provider={} subject={} reason={}",
                         unavailable.getProviderId(), subject, unavailable.getMessage());
                return Mono.just(List.of());
            });
    }
}
