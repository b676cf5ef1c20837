package com.flagship.recon_ledger.matching;

/**
 * Lifecycle of a reconciliation match.
 *
 * A match is born AUTO_ACCEPTED, PENDING_REVIEW or (manual path) ACCEPTED. Only
 * PENDING_REVIEW moves on: to ACCEPTED or REJECTED by a reviewer, or to SUPERSEDED when
 * the matcher finds a strictly better set.
 */
public enum MatchStatus {
    AUTO_ACCEPTED,
    PENDING_REVIEW,
    ACCEPTED,
    REJECTED,
    SUPERSEDED;

    public boolean isTerminal() {
        return this != PENDING_REVIEW;
    }

    /**
     * Counts as a confirmed link between transaction and entries.
     */
    public boolean isConfirmed() {
        return this == AUTO_ACCEPTED || this == ACCEPTED;
    }

    public boolean canTransitionTo(MatchStatus target) {
        return switch (this) {
            case PENDING_REVIEW -> target == ACCEPTED || target == REJECTED || target == SUPERSEDED;
            case AUTO_ACCEPTED, ACCEPTED, REJECTED, SUPERSEDED -> false;
        };
    }
}
