package com.positionintel.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Competitive position of one subject over a window, stamped with the {@link Tier}
 * of the data it was computed from.
 *
 * <p>Fields belonging to an unresolved half (pricing or capacity) are {@code null},
 * never zero. Consumers should branch on {@link #tier()} rather than null-check ad hoc.
 */
public record CompetitivePosition(
    @JsonProperty("subjectId")          String         subjectId,
    @JsonProperty("referencePrice")     BigDecimal     referencePrice,
    @JsonProperty("competitorAvgPrice") BigDecimal     competitorAvgPrice,
    @JsonProperty("priceAdvantage")     BigDecimal     priceAdvantage,
    @JsonProperty("priceGapPercent")    BigDecimal     priceGapPercent,
    @JsonProperty("marketPosition")     MarketPosition marketPosition,
    @JsonProperty("priceRank")          Integer        priceRank,
    @JsonProperty("subjectUnits")       Long           subjectUnits,
    @JsonProperty("totalUnits")         Long           totalUnits,
    @JsonProperty("sharePercent")       BigDecimal     sharePercent,
    @JsonProperty("shareRank")          Integer        shareRank,
    @JsonProperty("competitorCount")    int            competitorCount,
    @JsonProperty("tier")               Tier           tier
) {
    public CompetitivePosition {
        Objects.requireNonNull(subjectId, "subjectId");
        Objects.requireNonNull(tier, "tier");
    }

    public boolean hasPricing() {
        return referencePrice != null;
    }

    public boolean hasCapacity() {
        return sharePercent != null;
    }
}
