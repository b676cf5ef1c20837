package com.flagship.recon_ledger.scoring;

import com.flagship.recon_ledger.ledger.AccountType;
import com.flagship.recon_ledger.statement.TransactionDirection;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * How plausible a counterpart account type is for money moving in a given direction.
 *
 * Kept as data so the values can be reviewed and tuned without touching the scorer.
 */
public final class PlausibilityTable {

    private final Map<TransactionDirection, Map<AccountType, BigDecimal>> scores;
    private final BigDecimal assetViaClearing;
    private final BigDecimal assetOnly;
    private final BigDecimal fallback;
    private final BigDecimal wrongSide;

    public PlausibilityTable(Map<TransactionDirection, Map<AccountType, BigDecimal>> scores,
                             BigDecimal assetViaClearing, BigDecimal assetOnly,
                             BigDecimal fallback, BigDecimal wrongSide) {
        Map<TransactionDirection, Map<AccountType, BigDecimal>> copy = new EnumMap<>(TransactionDirection.class);
        scores.forEach((direction, row) -> copy.put(direction, Collections.unmodifiableMap(new EnumMap<>(row))));
        this.scores = Collections.unmodifiableMap(copy);
        this.assetViaClearing = assetViaClearing;
        this.assetOnly = assetOnly;
        this.fallback = fallback;
        this.wrongSide = wrongSide;
    }

    public static PlausibilityTable standard() {
        Map<AccountType, BigDecimal> in = new EnumMap<>(AccountType.class);
        in.put(AccountType.INCOME, score(100));
        in.put(AccountType.LIABILITY, score(85));
        in.put(AccountType.EQUITY, score(75));

        Map<AccountType, BigDecimal> out = new EnumMap<>(AccountType.class);
        out.put(AccountType.EXPENSE, score(100));
        out.put(AccountType.LIABILITY, score(90));
        out.put(AccountType.EQUITY, score(70));

        Map<TransactionDirection, Map<AccountType, BigDecimal>> table = new EnumMap<>(TransactionDirection.class);
        table.put(TransactionDirection.IN, in);
        table.put(TransactionDirection.OUT, out);
        return new PlausibilityTable(table, score(80), score(30), score(40), score(10));
    }

    /**
     * Score for a counterpart account type; the fallback score when the type has no row.
     */
    public BigDecimal lookup(TransactionDirection direction, AccountType counterpartType) {
        return scores.getOrDefault(direction, Map.of()).getOrDefault(counterpartType, fallback);
    }

    public BigDecimal assetViaClearing() {
        return assetViaClearing;
    }

    public BigDecimal assetOnly() {
        return assetOnly;
    }

    public BigDecimal fallback() {
        return fallback;
    }

    public BigDecimal wrongSide() {
        return wrongSide;
    }

    private static BigDecimal score(int value) {
        return BigDecimal.valueOf(value).setScale(4);
    }
}
