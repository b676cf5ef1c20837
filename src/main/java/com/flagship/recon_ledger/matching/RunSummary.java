package com.flagship.recon_ledger.matching;

import lombok.Value;

/**
 * Counters of a reconciliation run. Immutable; {@link #add} returns the updated copy.
 */
@Value
public class RunSummary {
    int processed;
    int matchesCreated;
    int autoAccepted;
    int pendingReview;
    int unmatched;
    int superseded;
    int unchanged;
    int skipped;
    int failed;

    public static RunSummary empty() {
        return new RunSummary(0, 0, 0, 0, 0, 0, 0, 0, 0);
    }

    public RunSummary add(MatchOutcome outcome) {
        MatchOutcome.Kind kind = outcome.getKind();
        return new RunSummary(
            processed + 1,
            matchesCreated + (outcome.createdMatch() ? 1 : 0),
            autoAccepted + (kind == MatchOutcome.Kind.AUTO_ACCEPTED ? 1 : 0),
            pendingReview + (kind == MatchOutcome.Kind.PENDING_REVIEW ? 1 : 0),
            unmatched + (kind == MatchOutcome.Kind.UNMATCHED ? 1 : 0),
            superseded + (outcome.isSuperseded() ? 1 : 0),
            unchanged + (kind == MatchOutcome.Kind.UNCHANGED ? 1 : 0),
            skipped + (kind == MatchOutcome.Kind.SKIPPED ? 1 : 0),
            failed);
    }

    public RunSummary addFailure() {
        return new RunSummary(processed + 1, matchesCreated, autoAccepted, pendingReview, unmatched,
            superseded, unchanged, skipped, failed + 1);
    }
}
