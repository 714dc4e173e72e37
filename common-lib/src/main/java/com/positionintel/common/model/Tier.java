package com.positionintel.common.model;

/**
 * Confidence level of a computed {@link CompetitivePosition}.
 *
 * <p>Declaration order is confidence order: {@link #MEASURED} &gt; {@link #PARTIAL} &gt; {@link #BASELINE}.
 * <ul>
 *   <li>{@code MEASURED}: pricing and capacity observed for the subject and at least one competitor</li>
 *   <li>{@code PARTIAL} : only one half observed, or no competitor seen; unresolved fields are null</li>
 *   <li>{@code BASELINE}: nothing observed; values come from configured static defaults</li>
 * </ul>
 */
public enum Tier {
    MEASURED,
    PARTIAL,
    BASELINE;

    /** True only for {@link #MEASURED}; callers may render anything else as flagged. */
    public boolean isAuthoritative() {
        return this == MEASURED;
    }

    public boolean isAtLeast(Tier other) {
        return ordinal() <= other.ordinal();
    }
}
