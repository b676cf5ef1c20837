package com.flagship.recon_ledger.statement;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA entity for bank transactions. Everything but the status is insert-only.
 */
@Entity
@Table(
    name = "bank_transactions",
    indexes = {
        @Index(name = "idx_bank_transactions_status", columnList = "status, txn_date"),
        @Index(name = "idx_bank_transactions_account", columnList = "source_account_id, txn_date")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BankTransactionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "batch_id", updatable = false)
    private UUID batchId;

    @Column(name = "source_account_id", nullable = false, updatable = false)
    private UUID sourceAccountId;

    @Column(name = "txn_date", nullable = false, updatable = false)
    private LocalDate txnDate;

    @Column(nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 3)
    private TransactionDirection direction;

    @Column(updatable = false, length = 500)
    private String description;

    @Column(updatable = false, length = 200)
    private String reference;

    @Column(nullable = false, updatable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private BankTransactionStatus status;

    @Column(name = "low_trust", nullable = false, updatable = false)
    private boolean lowTrust;

    @Version
    @Column(nullable = false)
    private Long version;

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

    static BankTransactionEntity fromDomain(BankTransaction txn) {
        BankTransactionEntity entity = new BankTransactionEntity();
        entity.id = txn.getId();
        entity.batchId = txn.getBatchId();
        entity.sourceAccountId = txn.getSourceAccountId();
        entity.txnDate = txn.getTxnDate();
        entity.amount = txn.getAmount();
        entity.direction = txn.getDirection();
        entity.description = txn.getDescription();
        entity.reference = txn.getReference();
        entity.currency = txn.getCurrency();
        entity.status = txn.getStatus();
        entity.lowTrust = txn.isLowTrust();
        return entity;
    }

    public BankTransaction toDomain() {
        return new BankTransaction(id, batchId, sourceAccountId, txnDate, amount, direction, description,
            reference, currency, status, lowTrust, version == null ? 0L : version, createdAt, updatedAt);
    }

    public void updateStatus(BankTransactionStatus newStatus) {
        this.status = newStatus;
    }
}
