package com.flagship.recon_ledger.review.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.recon_ledger.review.BatchItemResult;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class BatchItemResponse {

    @JsonProperty("match_id")
    UUID matchId;

    @JsonProperty("result")
    BatchItemResult.Result result;

    @JsonProperty("message")
    String message;

    @JsonProperty("blocking_check_ids")
    List<UUID> blockingCheckIds;

    public static BatchItemResponse from(BatchItemResult result) {
        return new BatchItemResponse(result.getMatchId(), result.getResult(), result.getMessage(),
            result.getBlockingCheckIds());
    }
}
