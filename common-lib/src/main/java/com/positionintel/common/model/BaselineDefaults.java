package com.positionintel.common.model;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The single home of static fallback values, consumed only when no observations resolve.
 *
 * <p>A subject gets a baseline when it has a per-subject reference price, or when a
 * network-wide default reference price is configured. Otherwise it has no baseline
 * and the lookup reports absence.
 *
 * @param defaultReferencePrice     network-wide reference price, or {@code null} for none
 * @param defaultCompetitorAvgPrice reference competitor average, may be {@code null}
 * @param defaultSharePercent       reference share, may be {@code null}
 * @param subjectReferencePrices    per-subject reference prices, keyed by normalized subject id
 */
public record BaselineDefaults(
    BigDecimal defaultReferencePrice,
    BigDecimal defaultCompetitorAvgPrice,
    BigDecimal defaultSharePercent,
    Map<String, BigDecimal> subjectReferencePrices
) {
    public BaselineDefaults {
        subjectReferencePrices = subjectReferencePrices == null
            ? Map.of()
            : subjectReferencePrices.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(
                    e -> normalize(e.getKey()), Map.Entry::getValue));
    }

    public static BaselineDefaults none() {
        return new BaselineDefaults(null, null, null, Map.of());
    }

    /** Static reference point for one subject. */
    public record Reference(BigDecimal referencePrice, BigDecimal competitorAvgPrice, BigDecimal sharePercent) {}

    public Optional<Reference> forSubject(String subjectId) {
        BigDecimal price = subjectReferencePrices.getOrDefault(normalize(subjectId), defaultReferencePrice);
        if (price == null) return Optional.empty();
        return Optional.of(new Reference(price, defaultCompetitorAvgPrice, defaultSharePercent));
    }

    private static String normalize(String subjectId) {
        return subjectId == null ? "" : subjectId.trim().toLowerCase(Locale.ROOT);
    }
}
