package com.flagship.recon_ledger.matching;

import com.flagship.recon_ledger.scoring.ScoreBreakdown;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

@Entity
@Table(name = "reconciliation_matches")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class MatchEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "bank_txn_id", nullable = false, updatable = false)
    private UUID bankTransactionId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "reconciliation_match_entries", joinColumns = @JoinColumn(name = "match_id"))
    @Column(name = "journal_entry_id", nullable = false, updatable = false)
    @OrderBy
    private Set<UUID> entryIds = new LinkedHashSet<>();

    @Column(name = "match_score", nullable = false, updatable = false)
    private int score;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "score_breakdown", nullable = false, updatable = false, columnDefinition = "jsonb")
    private Map<String, Object> breakdown;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private MatchStatus status;

    @Version
    @Column(nullable = false)
    private Long version;

    @Column(name = "run_id", updatable = false)
    private UUID runId;

    @Column(name = "previous_match_id", updatable = false)
    private UUID previousMatchId;

    @Column(name = "superseded_by_id")
    private UUID supersededById;

    @Column(name = "rejection_reason", length = 500)
    private String rejectionReason;

    @Column(name = "resolution_note", length = 500)
    private String resolutionNote;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    static MatchEntity fromDomain(ReconciliationMatch match) {
        MatchEntity entity = new MatchEntity();
        entity.id = match.getId();
        entity.bankTransactionId = match.getBankTransactionId();
        entity.entryIds = new LinkedHashSet<>(match.getEntryIds());
        entity.score = match.getScore();
        entity.breakdown = match.getBreakdown().toMap();
        entity.status = match.getStatus();
        entity.runId = match.getRunId();
        entity.previousMatchId = match.getPreviousMatchId();
        entity.supersededById = match.getSupersededById();
        entity.rejectionReason = match.getRejectionReason();
        entity.resolutionNote = match.getResolutionNote();
        entity.createdAt = match.getCreatedAt();
        entity.resolvedAt = match.getResolvedAt();
        return entity;
    }

    public ReconciliationMatch toDomain() {
        return ReconciliationMatch.builder()
            .id(id)
            .bankTransactionId(bankTransactionId)
            .entryIds(entryIds.stream().sorted().toList())
            .score(score)
            .breakdown(ScoreBreakdown.fromMap(breakdown))
            .status(status)
            .version(version == null ? 0L : version)
            .runId(runId)
            .previousMatchId(previousMatchId)
            .supersededById(supersededById)
            .rejectionReason(rejectionReason)
            .resolutionNote(resolutionNote)
            .createdAt(createdAt)
            .resolvedAt(resolvedAt)
            .build();
    }

    /**
     * Copies the mutable part of a transition. Entry set, score and lineage never change.
     */
    void updateFromDomain(ReconciliationMatch match) {
        this.status = match.getStatus();
        this.supersededById = match.getSupersededById();
        this.rejectionReason = match.getRejectionReason();
        this.resolutionNote = match.getResolutionNote();
        this.resolvedAt = match.getResolvedAt();
    }
}
