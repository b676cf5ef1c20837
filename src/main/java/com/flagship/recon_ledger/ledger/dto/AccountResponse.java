package com.flagship.recon_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.recon_ledger.ledger.Account;
import com.flagship.recon_ledger.ledger.AccountType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class AccountResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("code")
    String code;

    @JsonProperty("name")
    String name;

    @JsonProperty("type")
    AccountType type;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("active")
    boolean active;

    @JsonProperty("created_at")
    Instant createdAt;

    public static AccountResponse from(Account account) {
        return AccountResponse.builder()
            .id(account.getId())
            .code(account.getCode())
            .name(account.getName())
            .type(account.getType())
            .currency(account.getCurrency())
            .active(account.isActive())
            .createdAt(account.getCreatedAt())
            .build();
    }
}
