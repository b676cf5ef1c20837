package com.flagship.recon_ledger.matching.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.recon_ledger.matching.ReconciliationRun;
import com.flagship.recon_ledger.matching.RunStatus;
import com.flagship.recon_ledger.matching.RunSummary;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class RunResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("status")
    RunStatus status;

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("batch_id")
    UUID batchId;

    @JsonProperty("date_from")
    LocalDate dateFrom;

    @JsonProperty("date_to")
    LocalDate dateTo;

    @JsonProperty("processed")
    int processed;

    @JsonProperty("matches_created")
    int matchesCreated;

    @JsonProperty("auto_accepted")
    int autoAccepted;

    @JsonProperty("pending_review")
    int pendingReview;

    @JsonProperty("unmatched")
    int unmatched;

    @JsonProperty("superseded")
    int superseded;

    @JsonProperty("unchanged")
    int unchanged;

    @JsonProperty("skipped")
    int skipped;

    @JsonProperty("failed")
    int failed;

    @JsonProperty("started_at")
    Instant startedAt;

    @JsonProperty("finished_at")
    Instant finishedAt;

    public static RunResponse from(ReconciliationRun run) {
        RunSummary summary = run.getSummary();
        return RunResponse.builder()
            .id(run.getId())
            .status(run.getStatus())
            .accountId(run.getScope().getAccountId())
            .batchId(run.getScope().getBatchId())
            .dateFrom(run.getScope().getDateFrom())
            .dateTo(run.getScope().getDateTo())
            .processed(summary.getProcessed())
            .matchesCreated(summary.getMatchesCreated())
            .autoAccepted(summary.getAutoAccepted())
            .pendingReview(summary.getPendingReview())
            .unmatched(summary.getUnmatched())
            .superseded(summary.getSuperseded())
            .unchanged(summary.getUnchanged())
            .skipped(summary.getSkipped())
            .failed(summary.getFailed())
            .startedAt(run.getStartedAt())
            .finishedAt(run.getFinishedAt())
            .build();
    }
}
