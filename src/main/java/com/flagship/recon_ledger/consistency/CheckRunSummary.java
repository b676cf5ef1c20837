package com.flagship.recon_ledger.consistency;

import lombok.Value;

import java.util.List;

@Value
public class CheckRunSummary {
    int detected;
    int raised;
    int escalated;
    int alreadyKnown;
    List<CheckType> failedDetectors;
}
