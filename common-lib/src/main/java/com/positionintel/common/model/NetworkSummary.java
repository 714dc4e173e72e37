package com.positionintel.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Network-wide roll-up of several {@link CompetitivePosition}s.
 *
 * <p>{@code subjectsWithData} counts positions above {@link Tier#BASELINE}; the
 * advantage counters use the sign of {@code priceAdvantage} (negative = subject cheaper).
 */
public record NetworkSummary(
    @JsonProperty("totalSubjects")            int                       totalSubjects,
    @JsonProperty("subjectsWithData")         int                       subjectsWithData,
    @JsonProperty("avgCompetitorCount")       BigDecimal                avgCompetitorCount,
    @JsonProperty("subjectsWithAdvantage")    int                       subjectsWithAdvantage,
    @JsonProperty("subjectsWithDisadvantage") int                       subjectsWithDisadvantage,
    @JsonProperty("positions")                List<CompetitivePosition> positions
) {
    public NetworkSummary {
        positions = List.copyOf(positions);
    }

    public static NetworkSummary from(int totalSubjects, List<CompetitivePosition> positions) {
        List<CompetitivePosition> withData = positions.stream()
            .filter(p -> p.tier().isAtLeast(Tier.PARTIAL))
            .toList();

        int competitorTotal = withData.stream().mapToInt(CompetitivePosition::competitorCount).sum();
        BigDecimal avgCompetitors = withData.isEmpty()
            ? BigDecimal.ZERO
            : BigDecimal.valueOf(competitorTotal).divide(BigDecimal.valueOf(withData.size()), 2, RoundingMode.HALF_UP);

        int advantage = (int) withData.stream()
            .filter(p -> p.priceAdvantage() != null && p.priceAdvantage().signum() < 0)
            .count();
        int disadvantage = (int) withData.stream()
            .filter(p -> p.priceAdvantage() != null && p.priceAdvantage().signum() > 0)
            .count();

        return new NetworkSummary(totalSubjects, withData.size(), avgCompetitors,
            advantage, disadvantage, positions);
    }
}
