package com.positionintel.common.position;

import com.positionintel.common.model.BaselineDefaults;
import com.positionintel.common.model.CompetitivePosition;
import com.positionintel.common.model.MarketPosition;
import com.positionintel.common.model.MetricQuery;
import com.positionintel.common.model.ObservationRecord;
import com.positionintel.common.model.Tier;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Pure logic class. Turns pricing and capacity observations into a tier-stamped
 * {@link CompetitivePosition}.
 *
 * <p>No WebClient. No caching. No logging. No reactive types.
 *
 * <p>Subject ids are compared after trimming and lower-casing. A half (pricing or
 * capacity) is resolved when the subject has at least one observation in it.
 * Ranks are 1-based; ties are broken by subject id so results are deterministic.
 */
public final class PositionCalculator {

    static final int PRICE_SCALE   = 4;
    static final int PERCENT_SCALE = 2;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private PositionCalculator() {}

    /**
     * @return the position, or empty when neither half resolves for the subject
     */
    public static Optional<CompetitivePosition> calculate(String subjectId,
                                                          List<ObservationRecord> pricing,
                                                          List<ObservationRecord> capacity) {
        String subject = MetricQuery.normalize(subjectId);
        PricingHalf  p = pricingHalf(subject, pricing);
        CapacityHalf c = capacityHalf(subject, capacity);

        if (p == null && c == null) {
            return Optional.empty();
        }

        int competitors = competitorIds(subject, pricing, capacity).size();
        Tier tier = (p != null && c != null && competitors > 0) ? Tier.MEASURED : Tier.PARTIAL;

        return Optional.of(new CompetitivePosition(
            subject,
            p == null ? null : p.referencePrice(),
            p == null ? null : p.competitorAvgPrice(),
            p == null ? null : p.priceAdvantage(),
            p == null ? null : p.priceGapPercent(),
            p == null ? null : MarketPosition.fromPriceGap(p.priceGapPercent()),
            p == null ? null : p.priceRank(),
            c == null ? null : c.subjectUnits(),
            c == null ? null : c.totalUnits(),
            c == null ? null : c.sharePercent(),
            c == null ? null : c.shareRank(),
            competitors,
            tier
        ));
    }

    /**
     * Baseline result from a static reference point. Always stamped {@link Tier#BASELINE}
     * with no ranks, no units and zero competitors.
     */
    public static CompetitivePosition baseline(String subjectId, BaselineDefaults.Reference reference) {
        BigDecimal advantage = null;
        BigDecimal gap = null;
        if (reference.referencePrice() != null && reference.competitorAvgPrice() != null) {
            advantage = reference.referencePrice().subtract(reference.competitorAvgPrice());
            gap = gapPercent(advantage, reference.competitorAvgPrice());
        }
        return new CompetitivePosition(
            MetricQuery.normalize(subjectId),
            reference.referencePrice(),
            reference.competitorAvgPrice(),
            advantage,
            gap,
            MarketPosition.fromPriceGap(gap),
            null,
            null,
            null,
            reference.sharePercent(),
            null,
            0,
            Tier.BASELINE
        );
    }

    // ── pricing ─────────────────────────────────────────────────────────────

    record PricingHalf(BigDecimal referencePrice, BigDecimal competitorAvgPrice,
                       BigDecimal priceAdvantage, BigDecimal priceGapPercent, int priceRank) {}

    static PricingHalf pricingHalf(String subject, List<ObservationRecord> pricing) {
        List<BigDecimal> own = new ArrayList<>();
        List<BigDecimal> competitor = new ArrayList<>();
        for (ObservationRecord r : pricing) {
            (isSubject(subject, r) ? own : competitor).add(r.value());
        }
        if (own.isEmpty()) return null;

        BigDecimal reference = mean(own);
        BigDecimal competitorAvg = competitor.isEmpty() ? null : mean(competitor);
        BigDecimal advantage = competitorAvg == null ? null : reference.subtract(competitorAvg);
        BigDecimal gap = advantage == null ? null : gapPercent(advantage, competitorAvg);

        Map<String, BigDecimal> averages = groupBySubject(pricing, PositionCalculator::mean);
        int rank = rank(averages, subject, Comparator.naturalOrder());

        return new PricingHalf(reference, competitorAvg, advantage, gap, rank);
    }

    // ── capacity ────────────────────────────────────────────────────────────

    record CapacityHalf(long subjectUnits, long totalUnits, BigDecimal sharePercent, int shareRank) {}

    static CapacityHalf capacityHalf(String subject, List<ObservationRecord> capacity) {
        boolean observed = capacity.stream().anyMatch(r -> isSubject(subject, r));
        if (!observed) return null;

        Map<String, BigDecimal> units = groupBySubject(capacity, PositionCalculator::sum);
        BigDecimal total = sum(new ArrayList<>(units.values()));
        BigDecimal own = units.get(subject);

        BigDecimal share = total.signum() == 0
            ? BigDecimal.ZERO.setScale(PERCENT_SCALE)
            : own.multiply(HUNDRED).divide(total, PERCENT_SCALE, RoundingMode.HALF_UP);
        int rank = rank(units, subject, Comparator.<BigDecimal>reverseOrder());

        return new CapacityHalf(toUnits(own), toUnits(total), share, rank);
    }

    // ── helpers ─────────────────────────────────────────────────────────────

    /**
     * 1-based rank of {@code subject} among {@code values} ordered by {@code order},
     * ties broken by ascending subject id.
     */
    static int rank(Map<String, BigDecimal> values, String subject, Comparator<BigDecimal> order) {
        List<String> ordered = values.entrySet().stream()
            .sorted(Map.Entry.<String, BigDecimal>comparingByValue(order)
                .thenComparing(Map.Entry.<String, BigDecimal>comparingByKey()))
            .map(Map.Entry::getKey)
            .toList();
        return ordered.indexOf(subject) + 1;
    }

    static BigDecimal mean(List<BigDecimal> values) {
        return sum(values).divide(BigDecimal.valueOf(values.size()), PRICE_SCALE, RoundingMode.HALF_UP);
    }

    static BigDecimal sum(List<BigDecimal> values) {
        return values.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    static BigDecimal gapPercent(BigDecimal advantage, BigDecimal competitorAvg) {
        if (competitorAvg.signum() == 0) return null;
        return advantage.multiply(HUNDRED).divide(competitorAvg, PERCENT_SCALE, RoundingMode.HALF_UP);
    }

    static Set<String> competitorIds(String subject, List<ObservationRecord> pricing,
                                     List<ObservationRecord> capacity) {
        Set<String> ids = new TreeSet<>();
        for (List<ObservationRecord> records : List.of(pricing, capacity)) {
            for (ObservationRecord r : records) {
                String id = MetricQuery.normalize(r.subjectId());
                if (!id.equals(subject)) ids.add(id);
            }
        }
        return ids;
    }

    private static Map<String, BigDecimal> groupBySubject(List<ObservationRecord> records,
                                                         Function<List<BigDecimal>, BigDecimal> reducer) {
        Map<String, List<BigDecimal>> grouped = records.stream()
            .collect(Collectors.groupingBy(r -> MetricQuery.normalize(r.subjectId()), TreeMap::new,
                Collectors.mapping(ObservationRecord::value, Collectors.toList())));
        Map<String, BigDecimal> reduced = new TreeMap<>();
        grouped.forEach((id, values) -> reduced.put(id, reducer.apply(values)));
        return reduced;
    }

    private static boolean isSubject(String subject, ObservationRecord record) {
        return MetricQuery.normalize(record.subjectId()).equals(subject);
    }

    private static long toUnits(BigDecimal value) {
        return value.setScale(0, RoundingMode.HALF_UP).longValue();
    }
}
