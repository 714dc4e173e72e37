package com.positionintel.common.model;

import java.time.LocalDate;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Normalizable description of a position request. Two queries are cache-equivalent
 * iff their {@link #canonical()} strings are identical.
 */
public record MetricQuery(
    String subjectId,
    int windowDays,
    LocalDate asOf,
    Map<String, String> context
) {
    public MetricQuery {
        context = context == null ? Map.of() : Map.copyOf(context);
    }

    public static MetricQuery of(String subjectId, int windowDays, LocalDate asOf) {
        return new MetricQuery(subjectId, windowDays, asOf, Map.of());
    }

    public String normalizedSubject() {
        return normalize(subjectId);
    }

    public LocalDate windowStart() {
        return asOf.minusDays(windowDays);
    }

    /**
     * Canonical form: trimmed lower-case strings, context sorted by key.
     * Insertion order and incidental whitespace do not change the result.
     *
     * <p>Every string is written as {@code <length>:<value>} and the context is led by its
     * entry count, so a value containing {@code |}, {@code &} or {@code =} cannot stand in
     * for a delimiter. Distinct normalized queries never share a canonical form.
     */
    public String canonical() {
        Map<String, String> sorted = new TreeMap<>();
        context.forEach((k, v) -> sorted.put(normalize(k), normalize(v)));
        StringBuilder ctx = new StringBuilder().append(sorted.size());
        sorted.forEach((k, v) -> ctx.append('|').append(field(k)).append('=').append(field(v)));
        return "subject=" + field(normalizedSubject())
            + "|window=" + windowDays
            + "|asOf=" + asOf
            + "|context=" + ctx;
    }

    /** Trimmed, lower-cased; {@code null} becomes the empty string. */
    public static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    private static String field(String value) {
        return value.length() + ":" + value;
    }
}
