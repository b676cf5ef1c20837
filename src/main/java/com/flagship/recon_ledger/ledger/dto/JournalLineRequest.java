package com.flagship.recon_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.recon_ledger.ledger.Direction;
import com.flagship.recon_ledger.ledger.JournalLine;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Value
public class JournalLineRequest {

    @NotNull(message = "Account ID is required")
    @JsonProperty("account_id")
    UUID accountId;

    @NotNull(message = "Direction is required")
    @JsonProperty("direction")
    Direction direction;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0", message = "Amount must not be negative")
    @Digits(integer = 15, fraction = 4, message = "Amount allows at most 4 decimal places")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotNull(message = "Currency is required")
    @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter ISO code")
    @JsonProperty("currency")
    String currency;

    @Digits(integer = 11, fraction = 8, message = "FX rate allows at most 8 decimal places")
    @JsonProperty("fx_rate")
    BigDecimal fxRate;

    @JsonProperty("event_type")
    String eventType;

    @JsonProperty("tags")
    List<String> tags;

    public JournalLine toDomain() {
        return JournalLine.create(accountId, direction, amount, currency, fxRate, eventType, tags);
    }
}
