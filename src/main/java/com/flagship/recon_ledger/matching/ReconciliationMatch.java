package com.flagship.recon_ledger.matching;

import com.flagship.recon_ledger.scoring.MatchScore;
import com.flagship.recon_ledger.scoring.ScoreBreakdown;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Link between one bank transaction and one or more journal entries.
 *
 * Immutable; transitions return a new instance. A match is never edited into a
 * different entry set: a better proposal becomes a new match and the old one is
 * marked SUPERSEDED with a pointer to its replacement.
 */
@Value
@Builder(toBuilder = true)
public class ReconciliationMatch {
    UUID id;
    UUID bankTransactionId;
    List<UUID> entryIds;
    int score;
    ScoreBreakdown breakdown;
    MatchStatus status;
    long version;
    UUID runId;
    UUID previousMatchId;
    UUID supersededById;
    String rejectionReason;
    String resolutionNote;
    Instant createdAt;
    Instant resolvedAt;

    public static ReconciliationMatch create(UUID bankTransactionId, MatchScore score, MatchStatus status,
                                             UUID runId, UUID previousMatchId, String note) {
        if (status != MatchStatus.AUTO_ACCEPTED && status != MatchStatus.PENDING_REVIEW
                && status != MatchStatus.ACCEPTED) {
            throw new IllegalArgumentException("A match cannot be created as " + status);
        }
        Instant now = Instant.now();
        return ReconciliationMatch.builder()
            .id(UUID.randomUUID())
            .bankTransactionId(bankTransactionId)
            .entryIds(score.entryIds())
            .score(score.getScore())
            .breakdown(score.getBreakdown())
            .status(status)
            .runId(runId)
            .previousMatchId(previousMatchId)
            .resolutionNote(note)
            .createdAt(now)
            .resolvedAt(status == MatchStatus.PENDING_REVIEW ? null : now)
            .build();
    }

    public ReconciliationMatch accept(String note) {
        requireTransition(MatchStatus.ACCEPTED);
        return toBuilder().status(MatchStatus.ACCEPTED).resolutionNote(note).resolvedAt(Instant.now()).build();
    }

    public ReconciliationMatch reject(String reason) {
        requireTransition(MatchStatus.REJECTED);
        return toBuilder().status(MatchStatus.REJECTED).rejectionReason(reason).resolvedAt(Instant.now()).build();
    }

    public ReconciliationMatch supersede(UUID replacementId) {
        requireTransition(MatchStatus.SUPERSEDED);
        return toBuilder().status(MatchStatus.SUPERSEDED).supersededById(replacementId)
            .resolvedAt(Instant.now()).build();
    }

    public boolean hasEntrySet(Set<UUID> otherEntryIds) {
        return new HashSet<>(entryIds).equals(otherEntryIds);
    }

    public Set<UUID> entrySet() {
        return Set.copyOf(entryIds);
    }

    private void requireTransition(MatchStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException(
                String.format("Cannot move match %s from %s to %s", id, status, target));
        }
    }
}
