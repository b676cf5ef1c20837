package com.flagship.recon_ledger.matching;

import com.flagship.recon_ledger.statement.ReconciliationScope;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "reconciliation_runs")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ReconciliationRunEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "account_id", updatable = false)
    private UUID accountId;

    @Column(name = "batch_id", updatable = false)
    private UUID batchId;

    @Column(name = "date_from", updatable = false)
    private LocalDate dateFrom;

    @Column(name = "date_to", updatable = false)
    private LocalDate dateTo;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private RunStatus status;

    @Column(name = "idempotency_key", unique = true, updatable = false, length = 200)
    private String idempotencyKey;

    @Column(name = "processed", nullable = false)
    private int processed;

    @Column(name = "matches_created", nullable = false)
    private int matchesCreated;

    @Column(name = "auto_accepted", nullable = false)
    private int autoAccepted;

    @Column(name = "pending_review", nullable = false)
    private int pendingReview;

    @Column(name = "unmatched", nullable = false)
    private int unmatched;

    @Column(name = "superseded", nullable = false)
    private int superseded;

    @Column(name = "unchanged", nullable = false)
    private int unchanged;

    @Column(name = "skipped", nullable = false)
    private int skipped;

    @Column(name = "failed", nullable = false)
    private int failed;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    static ReconciliationRunEntity fromDomain(ReconciliationRun run) {
        ReconciliationRunEntity entity = new ReconciliationRunEntity();
        entity.id = run.getId();
        ReconciliationScope scope = run.getScope();
        entity.accountId = scope.getAccountId();
        entity.batchId = scope.getBatchId();
        entity.dateFrom = scope.getDateFrom();
        entity.dateTo = scope.getDateTo();
        entity.idempotencyKey = run.getIdempotencyKey();
        entity.startedAt = run.getStartedAt();
        entity.updateFromDomain(run);
        return entity;
    }

    void updateFromDomain(ReconciliationRun run) {
        RunSummary summary = run.getSummary();
        this.status = run.getStatus();
        this.processed = summary.getProcessed();
        this.matchesCreated = summary.getMatchesCreated();
        this.autoAccepted = summary.getAutoAccepted();
        this.pendingReview = summary.getPendingReview();
        this.unmatched = summary.getUnmatched();
        this.superseded = summary.getSuperseded();
        this.unchanged = summary.getUnchanged();
        this.skipped = summary.getSkipped();
        this.failed = summary.getFailed();
        this.finishedAt = run.getFinishedAt();
    }

    public ReconciliationRun toDomain() {
        return ReconciliationRun.builder()
            .id(id)
            .scope(new ReconciliationScope(accountId, batchId, dateFrom, dateTo))
            .status(status)
            .idempotencyKey(idempotencyKey)
            .summary(new RunSummary(processed, matchesCreated, autoAccepted, pendingReview, unmatched,
                superseded, unchanged, skipped, failed))
            .startedAt(startedAt)
            .finishedAt(finishedAt)
            .build();
    }
}
