package com.positionintel.common.model;

import java.math.BigDecimal;

/**
 * Coarse label for where a subject's price sits against its competitors.
 */
public enum MarketPosition {
    LEADING,
    COMPETITIVE,
    BEHIND;

    private static final BigDecimal BEHIND_ABOVE_PCT  = new BigDecimal("10");
    private static final BigDecimal LEADING_BELOW_PCT = new BigDecimal("-5");

    /**
     * @param priceGapPercent signed gap of the subject's price over the competitor average, in percent
     * @return the label, or {@code null} when the gap could not be computed
     */
    public static MarketPosition fromPriceGap(BigDecimal priceGapPercent) {
        if (priceGapPercent == null) return null;
        if (priceGapPercent.compareTo(BEHIND_ABOVE_PCT) > 0)  return BEHIND;
        if (priceGapPercent.compareTo(LEADING_BELOW_PCT) < 0) return LEADING;
        return COMPETITIVE;
    }
}
