package com.flagship.recon_ledger.ledger;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for accounts.
 *
 * Type, code and currency are not updatable; only the active flag changes.
 */
@Entity
@Table(
    name = "accounts",
    indexes = {
        @Index(name = "idx_accounts_code", columnList = "code", unique = true)
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AccountEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, updatable = false, length = 50)
    private String code;

    @Column(nullable = false, length = 200)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "account_type", nullable = false, updatable = false, length = 20)
    private AccountType type;

    @Column(nullable = false, updatable = false, length = 3)
    private String currency;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static AccountEntity fromDomain(Account account) {
        return new AccountEntity(
            account.getId(),
            account.getCode(),
            account.getName(),
            account.getType(),
            account.getCurrency(),
            account.isActive(),
            null, // set by @PrePersist
            null
        );
    }

    public Account toDomain() {
        return new Account(id, code, name, type, currency, active, createdAt, updatedAt);
    }

    /**
     * Only the active flag and display name are mutable.
     */
    void updateFromDomain(Account account) {
        this.name = account.getName();
        this.active = account.isActive();
    }
}
