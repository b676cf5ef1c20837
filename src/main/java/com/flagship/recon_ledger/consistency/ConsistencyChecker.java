package com.flagship.recon_ledger.consistency;

import com.flagship.recon_ledger.config.ReconciliationProperties;
import com.flagship.recon_ledger.exception.AlreadyProcessedException;
import com.flagship.recon_ledger.exception.NotFoundException;
import com.flagship.recon_ledger.matching.ReconciliationMatch;
import com.flagship.recon_ledger.observability.ReconciliationMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Runs the detectors, records what they find, and gates match decisions on open checks.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConsistencyChecker {

    private static final String AGGREGATE_TYPE = "ConsistencyCheck";

    private final List<ConsistencyDetector> detectors;
    private final CheckRecorder recorder;
    private final ConsistencyCheckRepository repository;
    private final ReconciliationProperties properties;
    private final ReconciliationMetrics metrics;

    /**
     * One pass over every detector. A failing detector is logged and reported in the
     * summary; the others still run. Each issue is recorded in its own transaction.
     */
    public CheckRunSummary runChecks() {
        int detected = 0;
        int raised = 0;
        int escalated = 0;
        int known = 0;
        List<CheckType> failed = new ArrayList<>();

        for (ConsistencyDetector detector : detectors) {
            List<DetectedIssue> issues;
            try {
                issues = detector.detect();
            } catch (RuntimeException e) {
                log.error("Consistency detector {} failed", detector.type(), e);
                failed.add(detector.type());
                continue;
            }
            detected += issues.size();
            for (DetectedIssue issue : issues) {
                switch (recorder.record(issue)) {
                    case RAISED -> raised++;
                    case ESCALATED -> escalated++;
                    case ALREADY_KNOWN -> known++;
                }
            }
        }

        log.info("Consistency pass finished: detected={}, raised={}, escalated={}, alreadyKnown={}, failedDetectors={}",
            detected, raised, escalated, known, failed);
        return new CheckRunSummary(detected, raised, escalated, known, List.copyOf(failed));
    }

    /**
     * @throws AlreadyProcessedException if the check is already resolved
     */
    @Transactional
    public ConsistencyCheck resolveCheck(UUID checkId, ResolutionAction action, String note) {
        ConsistencyCheckEntity entity = repository.findById(checkId)
            .orElseThrow(() -> new NotFoundException(AGGREGATE_TYPE, checkId));
        ConsistencyCheck current = entity.toDomain();
        if (!current.isPending()) {
            throw new AlreadyProcessedException(AGGREGATE_TYPE, checkId, current.getStatus().name());
        }

        ConsistencyCheck resolved = current.resolve(action, note);
        entity.updateFromDomain(resolved);
        repository.save(entity);
        metrics.recordCheckResolved(action);

        log.info("Consistency check {}: checkId={}, type={}, severity={}",
            action, checkId, resolved.getType(), resolved.getSeverity());
        return resolved;
    }

    @Transactional(readOnly = true)
    public ConsistencyCheck getCheck(UUID checkId) {
        return repository.findById(checkId)
            .map(ConsistencyCheckEntity::toDomain)
            .orElseThrow(() -> new NotFoundException(AGGREGATE_TYPE, checkId));
    }

    @Transactional(readOnly = true)
    public Page<ConsistencyCheck> listChecks(CheckStatus status, CheckType type, Severity minSeverity,
                                             Pageable pageable) {
        Severity floor = minSeverity == null ? Severity.LOW : minSeverity;
        return repository.search(status, type, floor.andAbove(), pageable).map(ConsistencyCheckEntity::toDomain);
    }

    /**
     * Pending checks at or above the blocking severity that mention the match, its
     * transaction or any of its entries.
     */
    @Transactional(readOnly = true)
    public List<ConsistencyCheck> blockingChecksFor(ReconciliationMatch match) {
        Set<UUID> subjectIds = new LinkedHashSet<>();
        subjectIds.add(match.getId());
        subjectIds.add(match.getBankTransactionId());
        subjectIds.addAll(match.getEntryIds());

        Severity gate = properties.getConsistency().getBlockingSeverity();
        return repository.findPendingForSubjects(subjectIds, gate.andAbove()).stream()
            .map(ConsistencyCheckEntity::toDomain)
            .sorted((a, b) -> a.getId().compareTo(b.getId()))
            .toList();
    }

    @Transactional(readOnly = true)
    public long countBlocking() {
        Severity gate = properties.getConsistency().getBlockingSeverity();
        return repository.countByStatusAndSeverityIn(CheckStatus.PENDING, gate.andAbove());
    }

    @Transactional(readOnly = true)
    public long countPending() {
        return repository.countByStatus(CheckStatus.PENDING);
    }
}
