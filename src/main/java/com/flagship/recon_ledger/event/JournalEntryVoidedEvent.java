package com.flagship.recon_ledger.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An entry was voided. {@code reversalEntryId} is null when a draft was voided in place.
 */
@Value
public class JournalEntryVoidedEvent implements DomainEvent {

    public static final String EVENT_TYPE = "JournalEntryVoided";

    UUID eventId;
    UUID entryId;
    UUID reversalEntryId;
    String reason;
    Instant occurredAt;

    public static JournalEntryVoidedEvent of(UUID entryId, UUID reversalEntryId, String reason) {
        return new JournalEntryVoidedEvent(UUID.randomUUID(), entryId, reversalEntryId, reason, Instant.now());
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
