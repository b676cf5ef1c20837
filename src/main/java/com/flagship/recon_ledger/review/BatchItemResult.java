package com.flagship.recon_ledger.review;

import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of one item of a batch accept or reject.
 */
@Value
public class BatchItemResult {

    public enum Result { OK, VERSION_CONFLICT, ALREADY_PROCESSED, BLOCKED, NOT_FOUND, INVALID, FAILED }

    UUID matchId;
    Result result;
    String message;
    List<UUID> blockingCheckIds;

    static BatchItemResult ok(UUID matchId) {
        return new BatchItemResult(matchId, Result.OK, null, List.of());
    }

    static BatchItemResult failed(UUID matchId, Result result, String message) {
        return new BatchItemResult(matchId, result, message, List.of());
    }

    static BatchItemResult blocked(UUID matchId, String message, List<UUID> checkIds) {
        return new BatchItemResult(matchId, Result.BLOCKED, message, List.copyOf(checkIds));
    }

    public boolean isOk() {
        return result == Result.OK;
    }
}
