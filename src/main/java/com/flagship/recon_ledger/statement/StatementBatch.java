package com.flagship.recon_ledger.statement;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One ingested statement extraction.
 *
 * A batch is trusted only when both the extractor's own balance check and ours pass.
 */
@Value
public class StatementBatch {
    UUID id;
    UUID sourceAccountId;
    LocalDate periodStart;
    LocalDate periodEnd;
    BigDecimal openingBalance;
    BigDecimal closingBalance;
    String currency;
    String documentReference;
    boolean extractorBalanceOk;
    boolean computedBalanceOk;
    int transactionCount;
    Instant createdAt;

    public boolean isLowTrust() {
        return !(extractorBalanceOk && computedBalanceOk);
    }
}
