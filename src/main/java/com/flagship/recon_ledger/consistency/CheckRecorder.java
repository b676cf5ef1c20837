package com.flagship.recon_ledger.consistency;

import com.flagship.recon_ledger.event.ConsistencyCheckRaisedEvent;
import com.flagship.recon_ledger.observability.ReconciliationMetrics;
import com.flagship.recon_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Turns detected issues into stored checks, at most once per fingerprint.
 *
 * A fingerprint already on file, in any status, is never raised again. A still-pending
 * check may be escalated when the same issue comes back more severe.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CheckRecorder {

    static final int MAX_FINGERPRINT_LENGTH = 600;
    static final String AGGREGATE_TYPE = "ConsistencyCheck";

    private final ConsistencyCheckRepository repository;
    private final OutboxService outboxService;
    private final ReconciliationMetrics metrics;

    public enum Outcome { RAISED, ESCALATED, ALREADY_KNOWN }

    /**
     * Joins the caller's transaction if there is one, so a matcher-raised check commits
     * or rolls back with the match it belongs to.
     */
    @Transactional
    public Outcome record(DetectedIssue issue) {
        String fingerprint = fingerprintOf(issue);
        Optional<ConsistencyCheckEntity> existing = repository.findByFingerprint(fingerprint);

        if (existing.isPresent()) {
            ConsistencyCheckEntity entity = existing.get();
            ConsistencyCheck current = entity.toDomain();
            if (current.isPending() && issue.getSeverity().compareTo(current.getSeverity()) > 0) {
                entity.updateFromDomain(current.escalate(issue.getSeverity()));
                repository.save(entity);
                log.info("Escalated consistency check: checkId={}, type={}, severity {} -> {}",
                    current.getId(), current.getType(), current.getSeverity(), issue.getSeverity());
                return Outcome.ESCALATED;
            }
            return Outcome.ALREADY_KNOWN;
        }

        ConsistencyCheck check = ConsistencyCheck.raise(issue, fingerprint);
        repository.save(ConsistencyCheckEntity.fromDomain(check));
        outboxService.saveEvent(AGGREGATE_TYPE, check.getId(),
            ConsistencyCheckRaisedEvent.EVENT_TYPE, ConsistencyCheckRaisedEvent.from(check));
        metrics.recordCheckRaised(check.getType(), check.getSeverity());

        log.info("Raised consistency check: checkId={}, type={}, severity={}, subjects={}",
            check.getId(), check.getType(), check.getSeverity(), check.getSubjects());
        return Outcome.RAISED;
    }

    static String fingerprintOf(DetectedIssue issue) {
        String raw = issue.fingerprint();
        if (raw.length() <= MAX_FINGERPRINT_LENGTH) {
            return raw;
        }
        return issue.getType() + "|md5:" + DigestUtils.md5DigestAsHex(raw.getBytes(StandardCharsets.UTF_8));
    }
}
