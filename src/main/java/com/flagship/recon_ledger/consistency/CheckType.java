package com.flagship.recon_ledger.consistency;

public enum CheckType {
    /**
     * A transaction or journal entry is part of more than one accepted match.
     */
    DUPLICATE_MATCH,

    /**
     * Two statement lines that look like the same bank movement reported twice.
     */
    DUPLICATE_TRANSACTION,

    /**
     * A clearing-account leg without its opposite leg inside the transfer window.
     */
    UNPAIRED_TRANSFER,

    /**
     * A match waiting for review longer than the configured age.
     */
    STALE_REVIEW,

    /**
     * The amount is far off the payee's usual amount.
     */
    PATTERN_DEVIATION
}
