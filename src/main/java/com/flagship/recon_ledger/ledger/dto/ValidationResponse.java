package com.flagship.recon_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.recon_ledger.ledger.Direction;
import com.flagship.recon_ledger.ledger.ValidationFailure;
import com.flagship.recon_ledger.ledger.ValidationResult;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class ValidationResponse {

    @JsonProperty("valid")
    boolean valid;

    @JsonProperty("failure")
    ValidationFailure failure;

    @JsonProperty("message")
    String message;

    @JsonProperty("delta")
    BigDecimal delta;

    @JsonProperty("short_side")
    Direction shortSide;

    public static ValidationResponse from(ValidationResult result) {
        return new ValidationResponse(result.isValid(), result.getFailure(), result.getMessage(),
            result.getDelta(), result.getShortSide());
    }
}
