package com.flagship.recon_ledger.scoring;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Previously accepted transactions of the same account and merchant.
 */
@Value
public class MatchHistory {
    List<Point> points;

    public static MatchHistory empty() {
        return new MatchHistory(List.of());
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    @Value
    public static class Point {
        LocalDate date;
        BigDecimal amount;
    }
}
