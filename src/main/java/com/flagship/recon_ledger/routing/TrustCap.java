package com.flagship.recon_ledger.routing;

/**
 * Reasons an auto-accept-worthy score is held back for review.
 */
public enum TrustCap {
    LOW_TRUST_STATEMENT,
    DRAFT_ENTRY,
    MULTI_ENTRY
}
