package com.flagship.recon_ledger.exception;

import java.util.List;
import java.util.UUID;

/**
 * Approval refused while unresolved consistency checks reference the match.
 */
public class ConsistencyBlockException extends RuntimeException {

    private final UUID matchId;
    private final List<UUID> blockingCheckIds;

    public ConsistencyBlockException(UUID matchId, List<UUID> blockingCheckIds) {
        super(String.format("Match %s is blocked by %d unresolved consistency check(s): %s",
                matchId, blockingCheckIds.size(), blockingCheckIds));
        this.matchId = matchId;
        this.blockingCheckIds = List.copyOf(blockingCheckIds);
    }

    public UUID getMatchId() {
        return matchId;
    }

    public List<UUID> getBlockingCheckIds() {
        return blockingCheckIds;
    }
}
