package com.flagship.recon_ledger.consistency;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A recorded data-quality finding awaiting (or past) human resolution.
 */
@Value
@Builder(toBuilder = true)
public class ConsistencyCheck {
    UUID id;
    CheckType type;
    Severity severity;
    CheckStatus status;
    String fingerprint;
    List<CheckSubject> subjects;
    Map<String, Object> details;
    ResolutionAction resolutionAction;
    String resolutionNote;
    Instant createdAt;
    Instant resolvedAt;

    public static ConsistencyCheck raise(DetectedIssue issue, String fingerprint) {
        return ConsistencyCheck.builder()
            .id(UUID.randomUUID())
            .type(issue.getType())
            .severity(issue.getSeverity())
            .status(CheckStatus.PENDING)
            .fingerprint(fingerprint)
            .subjects(issue.getSubjects().stream().sorted().distinct().toList())
            .details(issue.getDetails())
            .createdAt(Instant.now())
            .build();
    }

    /**
     * APPROVE and REJECT close the check. FLAG keeps it open and raises it to at least HIGH.
     *
     * @throws IllegalStateException if the check is already resolved
     */
    public ConsistencyCheck resolve(ResolutionAction action, String note) {
        if (status == CheckStatus.RESOLVED) {
            throw new IllegalStateException("Check " + id + " is already resolved");
        }
        if (action.closesCheck()) {
            return toBuilder()
                .status(CheckStatus.RESOLVED)
                .resolutionAction(action)
                .resolutionNote(note)
                .resolvedAt(Instant.now())
                .build();
        }
        return toBuilder()
            .severity(Severity.max(severity, Severity.HIGH))
            .resolutionAction(action)
            .resolutionNote(note)
            .build();
    }

    public ConsistencyCheck escalate(Severity newSeverity) {
        return toBuilder().severity(Severity.max(severity, newSeverity)).build();
    }

    public boolean isPending() {
        return status == CheckStatus.PENDING;
    }

    public boolean blocks(Severity gate) {
        return isPending() && severity.isAtLeast(gate);
    }
}
