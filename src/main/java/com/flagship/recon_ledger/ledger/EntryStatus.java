package com.flagship.recon_ledger.ledger;

/**
 * Journal entry lifecycle.
 *
 * <pre>
 * DRAFT -> POSTED -> RECONCILED
 * DRAFT -> VOID
 * </pre>
 *
 * Voiding a POSTED entry does not change its status: a separate reversal record is
 * written in VOID status and linked to it. RECONCILED and VOID are terminal.
 */
public enum EntryStatus {
    /**
     * Lines may still be edited. Not visible to reports.
     */
    DRAFT,

    /**
     * Balanced and authoritative for reporting. Lines are frozen.
     */
    POSTED,

    /**
     * Linked to an accepted bank transaction match.
     */
    RECONCILED,

    /**
     * Abandoned draft, or the reversal record of a voided posted entry.
     */
    VOID;

    public boolean isTerminal() {
        return this == RECONCILED || this == VOID;
    }

    public boolean isEditable() {
        return this == DRAFT;
    }

    public boolean canTransitionTo(EntryStatus target) {
        return switch (this) {
            case DRAFT -> target == POSTED || target == VOID;
            case POSTED -> target == RECONCILED;
            case RECONCILED, VOID -> false;
        };
    }
}
