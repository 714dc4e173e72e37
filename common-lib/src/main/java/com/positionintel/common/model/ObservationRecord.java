package com.positionintel.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * One upstream observation: a price or a unit count reported for a subject on a date.
 * Produced by observation sources and never mutated.
 */
public record ObservationRecord(
    @JsonProperty("providerId") String     providerId,
    @JsonProperty("subjectId")  String     subjectId,
    @JsonProperty("value")      BigDecimal value,
    @JsonProperty("observedAt") LocalDate  observedAt
) {
    public ObservationRecord {
        Objects.requireNonNull(subjectId, "subjectId");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(observedAt, "observedAt");
    }

    public static ObservationRecord of(String providerId, String subjectId, String value, LocalDate observedAt) {
        return new ObservationRecord(providerId, subjectId, new BigDecimal(value), observedAt);
    }

    /** Inclusive on both ends. */
    public boolean isWithin(LocalDate from, LocalDate to) {
        return !observedAt.isBefore(from) && !observedAt.isAfter(to);
    }
}
