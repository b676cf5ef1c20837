package com.flagship.recon_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.recon_ledger.ledger.AccountType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Value;

@Value
public class CreateAccountRequest {

    @NotBlank(message = "Account code is required")
    @JsonProperty("code")
    String code;

    @JsonProperty("name")
    String name;

    @NotNull(message = "Account type is required")
    @JsonProperty("type")
    AccountType type;

    @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter ISO code")
    @JsonProperty("currency")
    String currency;
}
