package com.flagship.recon_ledger.statement.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.recon_ledger.matching.dto.RunResponse;
import com.flagship.recon_ledger.statement.IngestionResult;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
public class StatementIngestionResponse {

    @JsonProperty("batch_id")
    UUID batchId;

    @JsonProperty("low_trust")
    boolean lowTrust;

    @JsonProperty("extractor_balance_ok")
    boolean extractorBalanceOk;

    @JsonProperty("computed_balance_ok")
    boolean computedBalanceOk;

    @JsonProperty("transaction_ids")
    List<UUID> transactionIds;

    /**
     * The matcher run started right after ingestion, when auto-run is enabled.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("run")
    RunResponse run;

    public static StatementIngestionResponse from(IngestionResult result, RunResponse run) {
        return new StatementIngestionResponse(result.getBatch().getId(), result.getBatch().isLowTrust(),
            result.getBatch().isExtractorBalanceOk(), result.getBatch().isComputedBalanceOk(),
            result.getTransactionIds(), run);
    }
}
