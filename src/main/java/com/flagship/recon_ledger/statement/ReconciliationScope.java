package com.flagship.recon_ledger.statement;

import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Which bank transactions an operation covers. Null fields are unrestricted.
 */
@Value
public class ReconciliationScope {
    UUID accountId;
    UUID batchId;
    LocalDate dateFrom;
    LocalDate dateTo;

    public ReconciliationScope(UUID accountId, UUID batchId, LocalDate dateFrom, LocalDate dateTo) {
        if (dateFrom != null && dateTo != null && dateFrom.isAfter(dateTo)) {
            throw new IllegalArgumentException("date_from " + dateFrom + " is after date_to " + dateTo);
        }
        this.accountId = accountId;
        this.batchId = batchId;
        this.dateFrom = dateFrom;
        this.dateTo = dateTo;
    }

    public static ReconciliationScope all() {
        return new ReconciliationScope(null, null, null, null);
    }

    public static ReconciliationScope batch(UUID batchId) {
        return new ReconciliationScope(null, batchId, null, null);
    }
}
