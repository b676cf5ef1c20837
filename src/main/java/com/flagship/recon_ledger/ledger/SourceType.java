package com.flagship.recon_ledger.ledger;

/**
 * Where a journal entry came from.
 */
public enum SourceType {
    MANUAL,
    BANK_STATEMENT,
    SYSTEM_ADJUSTMENT
}
