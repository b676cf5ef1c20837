package com.flagship.recon_ledger.scoring;

import lombok.Value;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unrounded per-dimension sub-scores (0..100, scale 4) behind a match score.
 *
 * Stored as jsonb on the match so a reviewer can see why a score came out the way it did.
 */
@Value
public class ScoreBreakdown {
    BigDecimal amount;
    BigDecimal date;
    BigDecimal description;
    BigDecimal businessFit;
    BigDecimal history;
    boolean historyDeviation;
    int entryCount;

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("amount", amount.toPlainString());
        map.put("date", date.toPlainString());
        map.put("description", description.toPlainString());
        map.put("business_fit", businessFit.toPlainString());
        map.put("history", history.toPlainString());
        map.put("history_deviation", historyDeviation);
        map.put("entry_count", entryCount);
        return map;
    }

    public static ScoreBreakdown fromMap(Map<String, Object> map) {
        return new ScoreBreakdown(
            decimal(map.get("amount")),
            decimal(map.get("date")),
            decimal(map.get("description")),
            decimal(map.get("business_fit")),
            decimal(map.get("history")),
            Boolean.TRUE.equals(map.get("history_deviation")),
            map.get("entry_count") instanceof Number n ? n.intValue() : 1);
    }

    private static BigDecimal decimal(Object value) {
        return value == null ? BigDecimal.ZERO : new BigDecimal(String.valueOf(value));
    }
}
