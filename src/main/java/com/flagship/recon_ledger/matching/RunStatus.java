package com.flagship.recon_ledger.matching;

public enum RunStatus {
    RUNNING,
    COMPLETED,
    CANCELLED,
    FAILED;

    public boolean isFinished() {
        return this != RUNNING;
    }
}
