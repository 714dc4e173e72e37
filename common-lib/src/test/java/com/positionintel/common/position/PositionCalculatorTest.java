package com.positionintel.common.position;

import com.positionintel.common.model.BaselineDefaults;
import com.positionintel.common.model.CompetitivePosition;
import com.positionintel.common.model.MarketPosition;
import com.positionintel.common.model.ObservationRecord;
import com.positionintel.common.model.Tier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link PositionCalculator}.
 * Covers tier selection, rank and share arithmetic, and baseline construction.
 */
class PositionCalculatorTest {

    private static final LocalDate DAY = LocalDate.of(2024, 1, 1);

    private static ObservationRecord price(String subject, String value) {
        return ObservationRecord.of("pricing", subject, value, DAY);
    }

    private static ObservationRecord units(String subject, String value) {
        return ObservationRecord.of("capacity", subject, value, DAY);
    }

    private static void assertDecimal(String expected, BigDecimal actual) {
        assertNotNull(actual, "expected " + expected + " but was null");
        assertEquals(0, new BigDecimal(expected).compareTo(actual),
            "expected " + expected + " but was " + actual);
    }

    // ── tier selection ────────────────────────────────────────────────────

    @Nested
    @DisplayName("calculate() — tier selection")
    class TierTests {

        @Test
        @DisplayName("pricing + capacity + competitor → MEASURED")
        void measured() {
            CompetitivePosition p = PositionCalculator.calculate("a",
                List.of(price("a", "100"), price("b", "120")),
                List.of(units("a", "300"), units("b", "100"))).orElseThrow();

            assertEquals(Tier.MEASURED, p.tier());
            assertTrue(p.hasPricing());
            assertTrue(p.hasCapacity());
            assertEquals(1, p.competitorCount());
        }

        @Test
        @DisplayName("pricing only → PARTIAL with capacity fields null, not zero")
        void pricingOnly() {
            CompetitivePosition p = PositionCalculator.calculate("a",
                List.of(price("a", "100"), price("b", "120")),
                List.of()).orElseThrow();

            assertEquals(Tier.PARTIAL, p.tier());
            assertNull(p.sharePercent());
            assertNull(p.shareRank());
            assertNull(p.subjectUnits());
            assertNull(p.totalUnits());
            assertDecimal("100", p.referencePrice());
        }

        @Test
        @DisplayName("capacity only → PARTIAL with pricing fields null")
        void capacityOnly() {
            CompetitivePosition p = PositionCalculator.calculate("a",
                List.of(),
                List.of(units("a", "300"), units("b", "100"))).orElseThrow();

            assertEquals(Tier.PARTIAL, p.tier());
            assertNull(p.referencePrice());
            assertNull(p.competitorAvgPrice());
            assertNull(p.priceAdvantage());
            assertNull(p.priceRank());
            assertNull(p.marketPosition());
            assertDecimal("75", p.sharePercent());
        }

        @Test
        @DisplayName("both halves for subject alone, no competitor → PARTIAL")
        void noCompetitor() {
            CompetitivePosition p = PositionCalculator.calculate("a",
                List.of(price("a", "100")),
                List.of(units("a", "300"))).orElseThrow();

            assertEquals(Tier.PARTIAL, p.tier());
            assertEquals(0, p.competitorCount());
            assertNull(p.competitorAvgPrice());
            assertNull(p.priceAdvantage());
            assertEquals(1, p.priceRank());
            assertDecimal("100", p.sharePercent());
        }

        @Test
        @DisplayName("competitors only, nothing for subject → empty")
        void competitorsOnly() {
            Optional<CompetitivePosition> p = PositionCalculator.calculate("a",
                List.of(price("b", "100")),
                List.of(units("b", "300")));

            assertTrue(p.isEmpty());
        }

        @Test
        @DisplayName("no observations at all → empty, no exception")
        void nothing() {
            assertTrue(PositionCalculator.calculate("a", List.of(), List.of()).isEmpty());
        }
    }

    // ── pricing ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("pricing arithmetic")
    class PricingTests {

        @Test
        @DisplayName("prices [90, 100, 100, 110], subject first at 100 → priceRank 2")
        void rankWithTie() {
            CompetitivePosition p = PositionCalculator.calculate("b",
                List.of(price("a", "90"), price("b", "100"), price("c", "100"), price("d", "110")),
                List.of()).orElseThrow();

            assertEquals(2, p.priceRank());
        }

        @Test
        @DisplayName("tie broken by subject id — later id ranks after")
        void tieBreakBySubjectId() {
            CompetitivePosition p = PositionCalculator.calculate("c",
                List.of(price("a", "90"), price("b", "100"), price("c", "100"), price("d", "110")),
                List.of()).orElseThrow();

            assertEquals(3, p.priceRank());
        }

        @Test
        @DisplayName("reference and competitor means, advantage positive when subject costlier")
        void meansAndAdvantage() {
            CompetitivePosition p = PositionCalculator.calculate("a",
                List.of(price("a", "110"), price("a", "130"), price("b", "90"), price("c", "110")),
                List.of()).orElseThrow();

            assertDecimal("120", p.referencePrice());
            assertDecimal("100", p.competitorAvgPrice());
            assertDecimal("20", p.priceAdvantage());
            assertDecimal("20.00", p.priceGapPercent());
            assertEquals(MarketPosition.BEHIND, p.marketPosition());
            assertEquals(3, p.priceRank());
        }

        @Test
        @DisplayName("cheaper subject → negative advantage, LEADING")
        void cheaperSubject() {
            CompetitivePosition p = PositionCalculator.calculate("a",
                List.of(price("a", "80"), price("b", "100")),
                List.of()).orElseThrow();

            assertDecimal("-20", p.priceAdvantage());
            assertEquals(MarketPosition.LEADING, p.marketPosition());
            assertEquals(1, p.priceRank());
        }

        @Test
        @DisplayName("subject ids compared case- and whitespace-insensitively")
        void normalizedIds() {
            CompetitivePosition p = PositionCalculator.calculate(" A ",
                List.of(price("a", "100"), price("A", "120"), price("b", "90")),
                List.of()).orElseThrow();

            assertEquals("a", p.subjectId());
            assertDecimal("110", p.referencePrice());
            assertEquals(1, p.competitorCount());
        }
    }

    // ── capacity ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("capacity arithmetic")
    class CapacityTests {

        @Test
        @DisplayName("units [500, 300, 300, 100], subject first at 300 → shareRank 2, share 25.0")
        void rankAndShare() {
            CompetitivePosition p = PositionCalculator.calculate("b",
                List.of(),
                List.of(units("a", "500"), units("b", "300"), units("c", "300"), units("d", "100")))
                .orElseThrow();

            assertEquals(2, p.shareRank());
            assertDecimal("25.0", p.sharePercent());
            assertEquals(300L, p.subjectUnits());
            assertEquals(1200L, p.totalUnits());
            assertEquals(3, p.competitorCount());
        }

        @Test
        @DisplayName("units summed per subject before ranking")
        void summedPerSubject() {
            CompetitivePosition p = PositionCalculator.calculate("a",
                List.of(),
                List.of(units("a", "200"), units("a", "200"), units("b", "300")))
                .orElseThrow();

            assertEquals(1, p.shareRank());
            assertEquals(400L, p.subjectUnits());
            assertEquals(700L, p.totalUnits());
        }

        @Test
        @DisplayName("zero total units → share 0, no division fault")
        void zeroTotal() {
            CompetitivePosition p = PositionCalculator.calculate("a",
                List.of(),
                List.of(units("a", "0"), units("b", "0")))
                .orElseThrow();

            assertDecimal("0", p.sharePercent());
            assertEquals(0L, p.totalUnits());
        }
    }

    // ── baseline ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("baseline()")
    class BaselineTests {

        @Test
        @DisplayName("always BASELINE, zero competitors, no ranks")
        void stampedBaseline() {
            CompetitivePosition p = PositionCalculator.baseline("A",
                new BaselineDefaults.Reference(new BigDecimal("99"), new BigDecimal("90"), new BigDecimal("12.5")));

            assertEquals(Tier.BASELINE, p.tier());
            assertFalse(p.tier().isAuthoritative());
            assertEquals("a", p.subjectId());
            assertEquals(0, p.competitorCount());
            assertNull(p.priceRank());
            assertNull(p.shareRank());
            assertDecimal("9", p.priceAdvantage());
            assertDecimal("10.00", p.priceGapPercent());
            assertEquals(MarketPosition.COMPETITIVE, p.marketPosition());
        }

        @Test
        @DisplayName("reference without competitor average → no advantage")
        void referenceOnly() {
            CompetitivePosition p = PositionCalculator.baseline("a",
                new BaselineDefaults.Reference(new BigDecimal("99"), null, null));

            assertNull(p.priceAdvantage());
            assertNull(p.marketPosition());
            assertNull(p.sharePercent());
        }
    }

    // ── helpers ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("helpers")
    class HelperTests {

        @Test
        @DisplayName("rank() descending with tie-break")
        void rankDescending() {
            Map<String, BigDecimal> values = Map.of(
                "x", new BigDecimal("5"), "y", new BigDecimal("7"), "w", new BigDecimal("5"));

            assertEquals(1, PositionCalculator.rank(values, "y", Comparator.reverseOrder()));
            assertEquals(2, PositionCalculator.rank(values, "w", Comparator.reverseOrder()));
            assertEquals(3, PositionCalculator.rank(values, "x", Comparator.reverseOrder()));
        }

        @Test
        @DisplayName("gapPercent() with zero competitor average → null")
        void gapAgainstZero() {
            assertNull(PositionCalculator.gapPercent(BigDecimal.ONE, BigDecimal.ZERO));
        }

        @Test
        @DisplayName("Deterministic — same input always produces same output")
        void deterministic() {
            List<ObservationRecord> pricing = List.of(price("a", "100"), price("b", "100"), price("c", "95"));
            List<ObservationRecord> capacity = List.of(units("a", "10"), units("c", "10"));

            CompetitivePosition first = PositionCalculator.calculate("a", pricing, capacity).orElseThrow();
            for (int i = 0; i < 100; i++) {
                assertEquals(first, PositionCalculator.calculate("a", pricing, capacity).orElseThrow(),
                    "Calculation must be deterministic on iteration " + i);
            }
        }
    }
}
