package com.flagship.recon_ledger.review;

import com.flagship.recon_ledger.matching.MatchStatus;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

@Value
public class ReviewStats {
    long totalTransactions;
    long matched;
    long unmatched;
    long pending;
    /**
     * matched / total at scale 4; zero when there are no transactions.
     */
    BigDecimal matchRate;
    Map<MatchStatus, Long> matchesByStatus;
    /**
     * Non-superseded matches per score band, in band order.
     */
    Map<String, Long> scoreHistogram;
}
