package com.flagship.recon_ledger.statement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.recon_ledger.statement.BankTransaction;
import com.flagship.recon_ledger.statement.BankTransactionStatus;
import com.flagship.recon_ledger.statement.TransactionDirection;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class BankTransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("batch_id")
    UUID batchId;

    @JsonProperty("source_account_id")
    UUID sourceAccountId;

    @JsonProperty("txn_date")
    LocalDate txnDate;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("direction")
    TransactionDirection direction;

    @JsonProperty("description")
    String description;

    @JsonProperty("reference")
    String reference;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("status")
    BankTransactionStatus status;

    @JsonProperty("low_trust")
    boolean lowTrust;

    public static BankTransactionResponse from(BankTransaction txn) {
        return BankTransactionResponse.builder()
            .id(txn.getId())
            .batchId(txn.getBatchId())
            .sourceAccountId(txn.getSourceAccountId())
            .txnDate(txn.getTxnDate())
            .amount(txn.getAmount())
            .direction(txn.getDirection())
            .description(txn.getDescription())
            .reference(txn.getReference())
            .currency(txn.getCurrency())
            .status(txn.getStatus())
            .lowTrust(txn.isLowTrust())
            .build();
    }
}
