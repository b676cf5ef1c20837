package com.flagship.recon_ledger.matching;

import lombok.Value;

import java.util.UUID;

/**
 * What matching one bank transaction did.
 */
@Value
public class MatchOutcome {

    public enum Kind { SKIPPED, AUTO_ACCEPTED, PENDING_REVIEW, UNMATCHED, UNCHANGED }

    Kind kind;
    UUID matchId;
    boolean superseded;

    static MatchOutcome skipped() {
        return new MatchOutcome(Kind.SKIPPED, null, false);
    }

    static MatchOutcome unmatched() {
        return new MatchOutcome(Kind.UNMATCHED, null, false);
    }

    static MatchOutcome unchanged(UUID existingMatchId) {
        return new MatchOutcome(Kind.UNCHANGED, existingMatchId, false);
    }

    static MatchOutcome created(MatchStatus status, UUID matchId, boolean superseded) {
        Kind kind = status == MatchStatus.PENDING_REVIEW ? Kind.PENDING_REVIEW : Kind.AUTO_ACCEPTED;
        return new MatchOutcome(kind, matchId, superseded);
    }

    public boolean createdMatch() {
        return kind == Kind.AUTO_ACCEPTED || kind == Kind.PENDING_REVIEW;
    }
}
