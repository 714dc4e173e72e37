package com.positionintel.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;

/**
 * Daily price statistics for a subject's market over {@code [from, to]}.
 *
 * <p>{@code points} holds one entry per (day, subject) pair that had at least one
 * observation, ordered by day and then by subject id. Competitors appear alongside
 * the requested subject. An empty list means nothing was observed in the window.
 */
public record CompetitiveTrends(
    @JsonProperty("subjectId") String                subjectId,
    @JsonProperty("from")      LocalDate             from,
    @JsonProperty("to")        LocalDate             to,
    @JsonProperty("points")    List<PriceTrendPoint> points
) {
    public CompetitiveTrends {
        points = List.copyOf(points);
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }
}
