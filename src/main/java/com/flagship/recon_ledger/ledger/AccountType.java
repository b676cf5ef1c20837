package com.flagship.recon_ledger.ledger;

/**
 * Account classification. Fixed at creation: changing it would silently
 * rewrite every historical accounting-equation check.
 */
public enum AccountType {
    ASSET,
    LIABILITY,
    EQUITY,
    INCOME,
    EXPENSE;

    /**
     * Debit-normal accounts grow with debits; the rest grow with credits.
     */
    public boolean isDebitNormal() {
        return switch (this) {
            case ASSET, EXPENSE -> true;
            case LIABILITY, EQUITY, INCOME -> false;
        };
    }
}
