package com.flagship.recon_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class VoidEntryRequest {

    @NotBlank(message = "Reason is required")
    @Size(max = 500)
    @JsonProperty("reason")
    String reason;

    @JsonCreator
    public VoidEntryRequest(@JsonProperty("reason") String reason) {
        this.reason = reason;
    }
}
