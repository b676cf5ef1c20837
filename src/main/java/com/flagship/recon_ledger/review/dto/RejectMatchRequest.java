package com.flagship.recon_ledger.review.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class RejectMatchRequest {

    @NotNull(message = "Version is required")
    @JsonProperty("version")
    Long version;

    @NotBlank(message = "Reason is required")
    @Size(max = 500)
    @JsonProperty("reason")
    String reason;
}
