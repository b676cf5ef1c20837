package com.flagship.recon_ledger.statement;

public enum BankTransactionStatus {
    /**
     * Not yet decided: never matched, or waiting on a pending-review match.
     */
    PENDING,

    /**
     * Linked to an accepted or auto-accepted match.
     */
    MATCHED,

    /**
     * Last matcher pass found nothing good enough, or the proposal was rejected.
     */
    UNMATCHED
}
