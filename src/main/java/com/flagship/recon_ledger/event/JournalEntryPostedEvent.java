package com.flagship.recon_ledger.event;

import com.flagship.recon_ledger.ledger.JournalEntry;
import com.flagship.recon_ledger.ledger.SourceType;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class JournalEntryPostedEvent implements DomainEvent {

    public static final String EVENT_TYPE = "JournalEntryPosted";

    UUID eventId;
    UUID entryId;
    LocalDate entryDate;
    SourceType sourceType;
    BigDecimal totalDebits;
    int lineCount;
    Instant occurredAt;

    public static JournalEntryPostedEvent from(JournalEntry entry) {
        return new JournalEntryPostedEvent(
            UUID.randomUUID(),
            entry.getId(),
            entry.getEntryDate(),
            entry.getSourceType(),
            entry.totalDebits(),
            entry.getLines().size(),
            Instant.now()
        );
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
