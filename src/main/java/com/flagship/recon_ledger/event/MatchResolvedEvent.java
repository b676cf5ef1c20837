package com.flagship.recon_ledger.event;

import com.flagship.recon_ledger.matching.ReconciliationMatch;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A reviewer accepted or rejected a pending match.
 */
@Value
public class MatchResolvedEvent implements DomainEvent {

    public static final String EVENT_TYPE = "MatchResolved";

    UUID eventId;
    UUID matchId;
    UUID bankTransactionId;
    String status;
    String rejectionReason;
    String resolutionNote;
    Instant occurredAt;

    public static MatchResolvedEvent from(ReconciliationMatch match) {
        return new MatchResolvedEvent(UUID.randomUUID(), match.getId(), match.getBankTransactionId(),
            match.getStatus().name(), match.getRejectionReason(), match.getResolutionNote(), Instant.now());
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
