package com.flagship.recon_ledger.review.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.UUID;

@Value
public class CreateEntryRequest {

    @NotNull(message = "Counter account id is required")
    @JsonProperty("counter_account_id")
    UUID counterAccountId;

    @Size(max = 500)
    @JsonProperty("memo")
    String memo;
}
