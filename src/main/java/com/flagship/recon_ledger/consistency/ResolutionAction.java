package com.flagship.recon_ledger.consistency;

/**
 * APPROVE and REJECT close a check. FLAG keeps it open and escalates it.
 */
public enum ResolutionAction {
    APPROVE,
    REJECT,
    FLAG;

    public boolean closesCheck() {
        return this != FLAG;
    }
}
