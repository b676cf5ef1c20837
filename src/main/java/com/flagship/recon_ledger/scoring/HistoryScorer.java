package com.flagship.recon_ledger.scoring;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Scores a transaction against the payee's accepted history.
 */
final class HistoryScorer {

    static final BigDecimal NO_HISTORY = BigDecimal.ZERO.setScale(4);
    static final BigDecimal DEVIATION = BigDecimal.valueOf(20).setScale(4);
    static final BigDecimal REGULAR = BigDecimal.valueOf(100).setScale(4);
    static final BigDecimal FAMILIAR = BigDecimal.valueOf(80).setScale(4);
    static final BigDecimal UNFAMILIAR = BigDecimal.valueOf(40).setScale(4);

    private static final BigDecimal DEVIATION_LIMIT = new BigDecimal("0.5");
    private static final long SPACING_SLACK_DAYS = 3;

    private HistoryScorer() {
    }

    @Value
    static class Result {
        BigDecimal score;
        boolean deviation;
    }

    static Result score(BigDecimal amount, LocalDate date, MatchHistory history, ScoringConfig config) {
        if (history.isEmpty()) {
            return new Result(NO_HISTORY, false);
        }

        BigDecimal median = median(history.getPoints().stream().map(MatchHistory.Point::getAmount).toList());
        if (median.signum() > 0) {
            BigDecimal deviation = amount.subtract(median).abs().divide(median, 8, RoundingMode.HALF_UP);
            if (deviation.compareTo(DEVIATION_LIMIT) > 0) {
                return new Result(DEVIATION, true);
            }
        }

        BigDecimal band = config.feeBand(amount);
        boolean familiarAmount = history.getPoints().stream()
            .anyMatch(p -> p.getAmount().subtract(amount).abs().compareTo(band) <= 0);
        if (!familiarAmount) {
            return new Result(UNFAMILIAR, false);
        }
        if (history.getPoints().size() >= 2 && regularlySpaced(history, date)) {
            return new Result(REGULAR, false);
        }
        return new Result(FAMILIAR, false);
    }

    private static boolean regularlySpaced(MatchHistory history, LocalDate current) {
        List<LocalDate> dates = new ArrayList<>(history.getPoints().stream().map(MatchHistory.Point::getDate).toList());
        dates.add(current);
        dates.sort(null);

        List<Long> intervals = new ArrayList<>();
        for (int i = 1; i < dates.size(); i++) {
            intervals.add(ChronoUnit.DAYS.between(dates.get(i - 1), dates.get(i)));
        }
        long medianInterval = medianLong(intervals);
        if (medianInterval <= 0) {
            return false;
        }
        return intervals.stream().allMatch(i -> Math.abs(i - medianInterval) <= SPACING_SLACK_DAYS);
    }

    static BigDecimal median(List<BigDecimal> values) {
        List<BigDecimal> sorted = values.stream().sorted().toList();
        int mid = sorted.size() / 2;
        if (sorted.size() % 2 == 1) {
            return sorted.get(mid);
        }
        return sorted.get(mid - 1).add(sorted.get(mid)).divide(BigDecimal.valueOf(2), 4, RoundingMode.HALF_UP);
    }

    private static long medianLong(List<Long> values) {
        List<Long> sorted = values.stream().sorted().toList();
        int mid = sorted.size() / 2;
        return sorted.size() % 2 == 1 ? sorted.get(mid) : (sorted.get(mid - 1) + sorted.get(mid)) / 2;
    }
}
