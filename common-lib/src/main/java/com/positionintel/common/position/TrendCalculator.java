package com.positionintel.common.position;

import com.positionintel.common.model.CompetitiveTrends;
import com.positionintel.common.model.MetricQuery;
import com.positionintel.common.model.ObservationRecord;
import com.positionintel.common.model.PriceTrendPoint;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Pure logic class. Groups pricing observations by day and subject into
 * {@link CompetitiveTrends}.
 *
 * <p>No WebClient. No caching. No logging. No reactive types.
 */
public final class TrendCalculator {

    private TrendCalculator() {}

    /**
     * Observations outside {@code [from, to]} are ignored. Subject ids are trimmed and
     * lower-cased before grouping, so {@code "U2"} and {@code "u2 "} land in one point.
     */
    public static CompetitiveTrends trends(String subjectId, LocalDate from, LocalDate to,
                                           List<ObservationRecord> pricing) {
        Map<LocalDate, Map<String, List<BigDecimal>>> byDay = new TreeMap<>();
        for (ObservationRecord r : pricing) {
            if (!r.isWithin(from, to)) continue;
            byDay.computeIfAbsent(r.observedAt(), day -> new TreeMap<>())
                 .computeIfAbsent(MetricQuery.normalize(r.subjectId()), id -> new ArrayList<>())
                 .add(r.value());
        }

        List<PriceTrendPoint> points = new ArrayList<>();
        byDay.forEach((day, bySubject) -> bySubject.forEach((id, values) -> points.add(new PriceTrendPoint(
            id,
            day,
            PositionCalculator.mean(values),
            Collections.min(values),
            Collections.max(values),
            values.size()))));

        return new CompetitiveTrends(MetricQuery.normalize(subjectId), from, to, points);
    }
}
