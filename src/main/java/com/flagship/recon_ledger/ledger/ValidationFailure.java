package com.flagship.recon_ledger.ledger;

/**
 * Reasons an entry cannot be posted or edited.
 */
public enum ValidationFailure {
    IMBALANCED,
    TOO_FEW_LINES,
    NON_POSITIVE_AMOUNT,
    MISSING_FX_RATE,
    INVALID_FX_RATE,
    MIXED_CURRENCY,
    UNKNOWN_ACCOUNT,
    INACTIVE_ACCOUNT,
    CLEARING_ACCOUNT_RESTRICTED,
    ENTRY_NOT_EDITABLE
}
