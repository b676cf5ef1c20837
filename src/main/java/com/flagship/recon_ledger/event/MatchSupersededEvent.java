package com.flagship.recon_ledger.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class MatchSupersededEvent implements DomainEvent {

    public static final String EVENT_TYPE = "MatchSuperseded";

    UUID eventId;
    UUID matchId;
    UUID supersededById;
    UUID bankTransactionId;
    Instant occurredAt;

    public static MatchSupersededEvent of(UUID matchId, UUID supersededById, UUID bankTransactionId) {
        return new MatchSupersededEvent(UUID.randomUUID(), matchId, supersededById, bankTransactionId, Instant.now());
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
