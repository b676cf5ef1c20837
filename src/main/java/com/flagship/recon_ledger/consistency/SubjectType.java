package com.flagship.recon_ledger.consistency;

public enum SubjectType {
    TRANSACTION,
    MATCH,
    ENTRY,
    LINE
}
