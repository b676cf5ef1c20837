package com.flagship.recon_ledger.statement;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "statement_batches")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class StatementBatchEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "source_account_id", nullable = false, updatable = false)
    private UUID sourceAccountId;

    @Column(name = "period_start", updatable = false)
    private LocalDate periodStart;

    @Column(name = "period_end", updatable = false)
    private LocalDate periodEnd;

    @Column(name = "opening_balance", updatable = false, precision = 19, scale = 4)
    private BigDecimal openingBalance;

    @Column(name = "closing_balance", updatable = false, precision = 19, scale = 4)
    private BigDecimal closingBalance;

    @Column(nullable = false, updatable = false, length = 3)
    private String currency;

    @Column(name = "document_reference", updatable = false, length = 200)
    private String documentReference;

    @Column(name = "extractor_balance_ok", nullable = false, updatable = false)
    private boolean extractorBalanceOk;

    @Column(name = "computed_balance_ok", nullable = false, updatable = false)
    private boolean computedBalanceOk;

    @Column(name = "transaction_count", nullable = false, updatable = false)
    private int transactionCount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static StatementBatchEntity fromDomain(StatementBatch batch) {
        StatementBatchEntity entity = new StatementBatchEntity();
        entity.id = batch.getId();
        entity.sourceAccountId = batch.getSourceAccountId();
        entity.periodStart = batch.getPeriodStart();
        entity.periodEnd = batch.getPeriodEnd();
        entity.openingBalance = batch.getOpeningBalance();
        entity.closingBalance = batch.getClosingBalance();
        entity.currency = batch.getCurrency();
        entity.documentReference = batch.getDocumentReference();
        entity.extractorBalanceOk = batch.isExtractorBalanceOk();
        entity.computedBalanceOk = batch.isComputedBalanceOk();
        entity.transactionCount = batch.getTransactionCount();
        return entity;
    }

    public StatementBatch toDomain() {
        return new StatementBatch(id, sourceAccountId, periodStart, periodEnd, openingBalance, closingBalance,
            currency, documentReference, extractorBalanceOk, computedBalanceOk, transactionCount, createdAt);
    }
}
