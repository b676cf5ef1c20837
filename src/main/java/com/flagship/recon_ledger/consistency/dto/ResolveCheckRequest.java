package com.flagship.recon_ledger.consistency.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.recon_ledger.consistency.ResolutionAction;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class ResolveCheckRequest {

    @NotNull(message = "Action is required")
    @JsonProperty("action")
    ResolutionAction action;

    @Size(max = 1000)
    @JsonProperty("note")
    String note;
}
