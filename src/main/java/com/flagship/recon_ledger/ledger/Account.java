package com.flagship.recon_ledger.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Ledger account. The type never changes after creation; accounts are
 * deactivated rather than deleted so historical lines keep their reference.
 */
@Value
public class Account {
    UUID id;
    String code;
    String name;
    AccountType type;
    String currency;
    boolean active;
    Instant createdAt;
    Instant updatedAt;

    public static Account create(UUID id, String code, String name, AccountType type, String currency) {
        Instant now = Instant.now();
        return new Account(id, code, name, type, currency, true, now, now);
    }

    /**
     * @throws IllegalStateException if the account is already inactive
     */
    public Account deactivate() {
        if (!active) {
            throw new IllegalStateException("Account " + id + " is already inactive");
        }
        return new Account(id, code, name, type, currency, false, createdAt, Instant.now());
    }
}
