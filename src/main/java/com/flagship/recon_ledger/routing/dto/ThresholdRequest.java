package com.flagship.recon_ledger.routing.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class ThresholdRequest {

    @NotNull
    @Min(0)
    @Max(100)
    @JsonProperty("auto_accept")
    Integer autoAccept;

    @NotNull
    @Min(0)
    @Max(100)
    @JsonProperty("review_floor")
    Integer reviewFloor;
}
