package com.flagship.recon_ledger.event;

import com.flagship.recon_ledger.consistency.ConsistencyCheck;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
public class ConsistencyCheckRaisedEvent implements DomainEvent {

    public static final String EVENT_TYPE = "ConsistencyCheckRaised";

    UUID eventId;
    UUID checkId;
    String checkType;
    String severity;
    List<String> subjects;
    Instant occurredAt;

    public static ConsistencyCheckRaisedEvent from(ConsistencyCheck check) {
        return new ConsistencyCheckRaisedEvent(UUID.randomUUID(), check.getId(), check.getType().name(),
            check.getSeverity().name(), check.getSubjects().stream().map(Object::toString).toList(), Instant.now());
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
