package com.flagship.recon_ledger.review.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class AcceptMatchRequest {

    @NotNull(message = "Version is required")
    @JsonProperty("version")
    Long version;

    @Size(max = 500)
    @JsonProperty("note")
    String note;
}
