package com.flagship.recon_ledger.routing.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.recon_ledger.routing.Thresholds;
import lombok.Value;

import java.util.UUID;

@Value
public class ThresholdResponse {

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("auto_accept")
    int autoAccept;

    @JsonProperty("review_floor")
    int reviewFloor;

    /**
     * "override" when the account has its own row, "default" otherwise.
     */
    @JsonProperty("source")
    String source;

    public static ThresholdResponse of(UUID accountId, Thresholds thresholds, boolean override) {
        return new ThresholdResponse(accountId, thresholds.getAutoAccept(), thresholds.getReviewFloor(),
            override ? "override" : "default");
    }
}
