package com.flagship.recon_ledger.scoring;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HistoryScorerTest {

    private final ScoringConfig config = ScoringConfig.defaults();

    @Test
    @DisplayName("No history scores 0 without a deviation")
    void testNoHistory() {
        HistoryScorer.Result result = HistoryScorer.score(new BigDecimal("15.99"), LocalDate.of(2024, 4, 1),
            MatchHistory.empty(), config);
        assertEquals(HistoryScorer.NO_HISTORY, result.getScore());
        assertFalse(result.isDeviation());
    }

    @Test
    @DisplayName("Monthly subscription at the usual amount is regular")
    void testRegularRecurringPayment() {
        MatchHistory history = new MatchHistory(List.of(
            point("2024-01-01", "15.99"),
            point("2024-01-31", "15.99"),
            point("2024-03-01", "15.99")));

        HistoryScorer.Result result = HistoryScorer.score(new BigDecimal("15.99"), LocalDate.of(2024, 3, 31),
            history, config);

        assertEquals(HistoryScorer.REGULAR, result.getScore());
        assertFalse(result.isDeviation());
    }

    @Test
    @DisplayName("Known amount at an irregular date is familiar")
    void testFamiliarAmount() {
        MatchHistory history = new MatchHistory(List.of(
            point("2024-01-01", "50.00"),
            point("2024-01-05", "50.00")));

        HistoryScorer.Result result = HistoryScorer.score(new BigDecimal("50.00"), LocalDate.of(2024, 3, 20),
            history, config);

        assertEquals(HistoryScorer.FAMILIAR, result.getScore());
    }

    @Test
    @DisplayName("Amount more than 50 percent off the median is a deviation")
    void testDeviation() {
        MatchHistory history = new MatchHistory(List.of(
            point("2024-01-01", "100.00"),
            point("2024-02-01", "100.00")));

        HistoryScorer.Result result = HistoryScorer.score(new BigDecimal("180.00"), LocalDate.of(2024, 3, 1),
            history, config);

        assertEquals(HistoryScorer.DEVIATION, result.getScore());
        assertTrue(result.isDeviation());
    }

    @Test
    @DisplayName("Amount within the deviation limit but never seen before is unfamiliar")
    void testUnfamiliar() {
        MatchHistory history = new MatchHistory(List.of(point("2024-01-01", "100.00")));

        HistoryScorer.Result result = HistoryScorer.score(new BigDecimal("120.00"), LocalDate.of(2024, 2, 1),
            history, config);

        assertEquals(HistoryScorer.UNFAMILIAR, result.getScore());
        assertFalse(result.isDeviation());
    }

    @Test
    @DisplayName("Median of an even list averages the middle pair")
    void testMedian() {
        assertEquals(0, new BigDecimal("15").compareTo(HistoryScorer.median(List.of(
            new BigDecimal("20"), new BigDecimal("10"), new BigDecimal("5"), new BigDecimal("40")))));
    }

    private static MatchHistory.Point point(String date, String amount) {
        return new MatchHistory.Point(LocalDate.parse(date), new BigDecimal(amount));
    }
}
