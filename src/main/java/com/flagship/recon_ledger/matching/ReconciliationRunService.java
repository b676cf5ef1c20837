package com.flagship.recon_ledger.matching;

import com.flagship.recon_ledger.exception.AlreadyProcessedException;
import com.flagship.recon_ledger.exception.NotFoundException;
import com.flagship.recon_ledger.observability.CorrelationContext;
import com.flagship.recon_ledger.observability.ReconciliationMetrics;
import com.flagship.recon_ledger.statement.CandidateSource;
import com.flagship.recon_ledger.statement.ReconciliationScope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives the matcher over every open transaction in a scope.
 *
 * A run executes in the calling thread. Each transaction is matched in its own
 * transaction; a failure is counted and logged and the run moves on. Cancellation is
 * cooperative: the flag is checked between transactions, so matches already written stay.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReconciliationRunService {

    private static final String AGGREGATE_TYPE = "ReconciliationRun";
    private static final int PROGRESS_EVERY = 50;

    private final ReconciliationRunRepository runRepository;
    private final CandidateSource candidateSource;
    private final TransactionMatcher matcher;
    private final RunIdempotencyService idempotencyService;
    private final ReconciliationMetrics metrics;

    private final Map<UUID, AtomicBoolean> cancelFlags = new ConcurrentHashMap<>();

    /**
     * Runs the matcher over the scope. With an idempotency key already seen, returns the
     * earlier run untouched.
     */
    public ReconciliationRun run(ReconciliationScope scope, String idempotencyKey) {
        if (idempotencyKey != null) {
            Optional<UUID> previous = idempotencyService.findRun(idempotencyKey);
            if (previous.isPresent()) {
                metrics.recordIdempotencyHit();
                log.info("Returning existing run for idempotency key: key={}, runId={}", idempotencyKey, previous.get());
                return getRun(previous.get());
            }
            metrics.recordIdempotencyMiss();
        }

        ReconciliationRun run = ReconciliationRun.start(scope, idempotencyKey);
        try {
            runRepository.saveAndFlush(ReconciliationRunEntity.fromDomain(run));
        } catch (DataIntegrityViolationException e) {
            // A concurrent request with the same key won the insert.
            return runRepository.findByIdempotencyKey(idempotencyKey)
                .map(ReconciliationRunEntity::toDomain)
                .orElseThrow(() -> e);
        }
        if (idempotencyKey != null) {
            idempotencyService.remember(idempotencyKey, run.getId());
        }

        AtomicBoolean cancelled = new AtomicBoolean(false);
        cancelFlags.put(run.getId(), cancelled);
        MDC.put(CorrelationContext.RUN_ID_MDC_KEY, run.getId().toString());
        try {
            return execute(run, cancelled);
        } finally {
            cancelFlags.remove(run.getId());
            MDC.remove(CorrelationContext.RUN_ID_MDC_KEY);
        }
    }

    private ReconciliationRun execute(ReconciliationRun run, AtomicBoolean cancelled) {
        log.info("Reconciliation run started: runId={}, scope={}", run.getId(), run.getScope());
        RunSummary summary = RunSummary.empty();
        RunStatus finalStatus = RunStatus.COMPLETED;

        try {
            List<UUID> transactionIds = candidateSource.transactionsToMatch(run.getScope());
            for (UUID transactionId : transactionIds) {
                if (cancelled.get()) {
                    finalStatus = RunStatus.CANCELLED;
                    break;
                }
                try {
                    summary = summary.add(matcher.matchTransaction(transactionId, run.getId()));
                } catch (RuntimeException e) {
                    log.error("Failed to match transaction: runId={}, txnId={}", run.getId(), transactionId, e);
                    metrics.recordTransactionFailed();
                    summary = summary.addFailure();
                }
                if (summary.getProcessed() % PROGRESS_EVERY == 0) {
                    saveProgress(run.toBuilder().summary(summary).build());
                }
            }
        } catch (RuntimeException e) {
            log.error("Reconciliation run aborted: runId={}", run.getId(), e);
            finalStatus = RunStatus.FAILED;
        }

        ReconciliationRun finished = run.finish(finalStatus, summary);
        saveProgress(finished);
        metrics.recordRunFinished(finalStatus, Duration.between(finished.getStartedAt(), finished.getFinishedAt()));
        log.info("Reconciliation run finished: runId={}, status={}, summary={}",
            finished.getId(), finalStatus, summary);
        return finished;
    }

    /**
     * Asks a running run to stop after the transaction it is on. A RUNNING row with no
     * live run behind it (left over from a restart) is marked cancelled directly.
     *
     * @throws AlreadyProcessedException if the run already finished
     */
    public ReconciliationRun cancel(UUID runId) {
        ReconciliationRun run = getRun(runId);
        if (run.getStatus().isFinished()) {
            throw new AlreadyProcessedException(AGGREGATE_TYPE, runId, run.getStatus().name());
        }

        AtomicBoolean flag = cancelFlags.get(runId);
        if (flag != null) {
            flag.set(true);
            log.info("Cancellation requested: runId={}", runId);
            return run;
        }

        ReconciliationRun orphan = run.finish(RunStatus.CANCELLED, run.getSummary());
        saveProgress(orphan);
        log.warn("Cancelled orphaned run: runId={}", runId);
        return orphan;
    }

    public ReconciliationRun getRun(UUID runId) {
        return runRepository.findById(runId)
            .map(ReconciliationRunEntity::toDomain)
            .orElseThrow(() -> new NotFoundException(AGGREGATE_TYPE, runId));
    }

    public boolean isActive(UUID runId) {
        return cancelFlags.containsKey(runId);
    }

    private void saveProgress(ReconciliationRun run) {
        ReconciliationRunEntity entity = runRepository.findById(run.getId())
            .orElseThrow(() -> new NotFoundException(AGGREGATE_TYPE, run.getId()));
        entity.updateFromDomain(run);
        runRepository.save(entity);
    }
}
