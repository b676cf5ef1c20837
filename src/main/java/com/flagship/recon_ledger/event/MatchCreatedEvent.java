package com.flagship.recon_ledger.event;

import com.flagship.recon_ledger.matching.ReconciliationMatch;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
public class MatchCreatedEvent implements DomainEvent {

    public static final String EVENT_TYPE = "MatchCreated";

    UUID eventId;
    UUID matchId;
    UUID bankTransactionId;
    List<UUID> entryIds;
    int score;
    String status;
    UUID runId;
    UUID previousMatchId;
    Instant occurredAt;

    public static MatchCreatedEvent from(ReconciliationMatch match) {
        return new MatchCreatedEvent(UUID.randomUUID(), match.getId(), match.getBankTransactionId(),
            match.getEntryIds(), match.getScore(), match.getStatus().name(), match.getRunId(),
            match.getPreviousMatchId(), Instant.now());
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
