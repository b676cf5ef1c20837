package com.flagship.recon_ledger.statement;

/**
 * Money into (IN) or out of (OUT) the statement's account.
 */
public enum TransactionDirection {
    IN,
    OUT
}
