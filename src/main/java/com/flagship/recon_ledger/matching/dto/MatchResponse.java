package com.flagship.recon_ledger.matching.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.recon_ledger.matching.MatchStatus;
import com.flagship.recon_ledger.matching.ReconciliationMatch;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class MatchResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("bank_transaction_id")
    UUID bankTransactionId;

    @JsonProperty("entry_ids")
    List<UUID> entryIds;

    @JsonProperty("score")
    int score;

    @JsonProperty("score_breakdown")
    Map<String, Object> scoreBreakdown;

    @JsonProperty("status")
    MatchStatus status;

    @JsonProperty("version")
    long version;

    @JsonProperty("run_id")
    UUID runId;

    @JsonProperty("previous_match_id")
    UUID previousMatchId;

    @JsonProperty("superseded_by_id")
    UUID supersededById;

    @JsonProperty("rejection_reason")
    String rejectionReason;

    @JsonProperty("resolution_note")
    String resolutionNote;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("resolved_at")
    Instant resolvedAt;

    public static MatchResponse from(ReconciliationMatch match) {
        return MatchResponse.builder()
            .id(match.getId())
            .bankTransactionId(match.getBankTransactionId())
            .entryIds(match.getEntryIds())
            .score(match.getScore())
            .scoreBreakdown(match.getBreakdown().toMap())
            .status(match.getStatus())
            .version(match.getVersion())
            .runId(match.getRunId())
            .previousMatchId(match.getPreviousMatchId())
            .supersededById(match.getSupersededById())
            .rejectionReason(match.getRejectionReason())
            .resolutionNote(match.getResolutionNote())
            .createdAt(match.getCreatedAt())
            .resolvedAt(match.getResolvedAt())
            .build();
    }
}
