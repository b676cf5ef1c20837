package com.flagship.recon_ledger.statement;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Structured output of the statement extractor for one document.
 */
@Value
public class StatementExtraction {
    UUID sourceAccountId;
    LocalDate periodStart;
    LocalDate periodEnd;
    BigDecimal openingBalance;
    BigDecimal closingBalance;
    String currency;
    String documentReference;
    boolean extractorBalanceOk;
    List<Line> transactions;

    @Value
    public static class Line {
        LocalDate txnDate;
        BigDecimal amount;
        TransactionDirection direction;
        String description;
        String reference;
        String currency;
    }
}
