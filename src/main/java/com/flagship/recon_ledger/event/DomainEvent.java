package com.flagship.recon_ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for events written to the outbox.
 *
 * Every event carries a unique id, used by consumers for de-duplication.
 */
public interface DomainEvent {

    UUID getEventId();

    Instant getOccurredAt();

    String getEventType();
}
