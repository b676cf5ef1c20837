package com.flagship.recon_ledger.matching.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.recon_ledger.statement.ReconciliationScope;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Run scope. Every field is optional; an empty body matches all open transactions.
 */
@Value
public class StartRunRequest {

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("batch_id")
    UUID batchId;

    @JsonProperty("date_from")
    LocalDate dateFrom;

    @JsonProperty("date_to")
    LocalDate dateTo;

    public ReconciliationScope toScope() {
        return new ReconciliationScope(accountId, batchId, dateFrom, dateTo);
    }
}
