package com.flagship.recon_ledger.consistency;

public enum CheckStatus {
    PENDING,
    RESOLVED
}
