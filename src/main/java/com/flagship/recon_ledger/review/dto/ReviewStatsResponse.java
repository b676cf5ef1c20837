package com.flagship.recon_ledger.review.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.recon_ledger.matching.MatchStatus;
import com.flagship.recon_ledger.review.ReviewStats;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

@Value
public class ReviewStatsResponse {

    @JsonProperty("total_transactions")
    long totalTransactions;

    @JsonProperty("matched")
    long matched;

    @JsonProperty("unmatched")
    long unmatched;

    @JsonProperty("pending")
    long pending;

    @JsonProperty("match_rate")
    BigDecimal matchRate;

    @JsonProperty("matches_by_status")
    Map<MatchStatus, Long> matchesByStatus;

    @JsonProperty("score_histogram")
    Map<String, Long> scoreHistogram;

    public static ReviewStatsResponse from(ReviewStats stats) {
        return new ReviewStatsResponse(stats.getTotalTransactions(), stats.getMatched(), stats.getUnmatched(),
            stats.getPending(), stats.getMatchRate(), stats.getMatchesByStatus(), stats.getScoreHistogram());
    }
}
