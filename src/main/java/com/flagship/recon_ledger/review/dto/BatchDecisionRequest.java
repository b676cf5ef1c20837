package com.flagship.recon_ledger.review.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.recon_ledger.review.BatchItem;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Body of batch-accept and batch-reject. {@code reason} is required for reject only.
 */
@Value
public class BatchDecisionRequest {

    @NotEmpty(message = "At least one item is required")
    @Size(max = 500)
    @Valid
    @JsonProperty("items")
    List<Item> items;

    @Size(max = 500)
    @JsonProperty("note")
    String note;

    @Size(max = 500)
    @JsonProperty("reason")
    String reason;

    @Value
    public static class Item {
        @NotNull(message = "Match id is required")
        @JsonProperty("match_id")
        UUID matchId;

        @NotNull(message = "Version is required")
        @JsonProperty("version")
        Long version;
    }

    public List<BatchItem> toBatchItems() {
        return items.stream().map(i -> new BatchItem(i.getMatchId(), i.getVersion())).toList();
    }
}
