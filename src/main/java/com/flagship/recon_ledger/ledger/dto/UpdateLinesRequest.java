package com.flagship.recon_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.List;

@Value
public class UpdateLinesRequest {

    @NotNull(message = "Version is required")
    @JsonProperty("version")
    Long version;

    @NotNull(message = "Lines are required")
    @Valid
    @JsonProperty("lines")
    List<JournalLineRequest> lines;
}
