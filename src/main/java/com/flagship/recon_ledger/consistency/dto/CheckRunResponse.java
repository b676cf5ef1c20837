package com.flagship.recon_ledger.consistency.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.recon_ledger.consistency.CheckRunSummary;
import com.flagship.recon_ledger.consistency.CheckType;
import lombok.Value;

import java.util.List;

@Value
public class CheckRunResponse {

    @JsonProperty("detected")
    int detected;

    @JsonProperty("raised")
    int raised;

    @JsonProperty("escalated")
    int escalated;

    @JsonProperty("already_known")
    int alreadyKnown;

    @JsonProperty("failed_detectors")
    List<CheckType> failedDetectors;

    public static CheckRunResponse from(CheckRunSummary summary) {
        return new CheckRunResponse(summary.getDetected(), summary.getRaised(), summary.getEscalated(),
            summary.getAlreadyKnown(), summary.getFailedDetectors());
    }
}
