package com.flagship.recon_ledger.review.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.Set;
import java.util.UUID;

@Value
public class ManualMatchRequest {

    @NotNull(message = "Transaction id is required")
    @JsonProperty("transaction_id")
    UUID transactionId;

    @NotEmpty(message = "At least one entry id is required")
    @JsonProperty("entry_ids")
    Set<UUID> entryIds;

    @Size(max = 500)
    @JsonProperty("note")
    String note;
}
