package com.flagship.recon_ledger.observability;

import com.flagship.recon_ledger.consistency.CheckType;
import com.flagship.recon_ledger.consistency.ResolutionAction;
import com.flagship.recon_ledger.consistency.Severity;
import com.flagship.recon_ledger.ledger.SourceType;
import com.flagship.recon_ledger.ledger.ValidationFailure;
import com.flagship.recon_ledger.matching.MatchStatus;
import com.flagship.recon_ledger.matching.RunStatus;
import com.flagship.recon_ledger.routing.RoutingDecision;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Counters and timers for ledger postings and the reconciliation engine.
 *
 * Tag values come from closed enums wherever possible; free-form values go through
 * {@link #sanitizeTag} to keep cardinality bounded.
 */
@Component
public class ReconciliationMetrics {

    private final MeterRegistry registry;
    private final Timer transactionMatchTimer;
    private final DistributionSummary matchScores;

    public ReconciliationMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.transactionMatchTimer = Timer.builder("reconciliation.transaction.duration")
            .description("Time to score and route one bank transaction")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(registry);
        this.matchScores = DistributionSummary.builder("reconciliation.match.score")
            .description("Composite scores of persisted matches")
            .serviceLevelObjectives(60, 80, 85, 90)
            .register(registry);
    }

    // Ledger

    public void recordValidationFailure(ValidationFailure failure) {
        registry.counter("ledger.validation.failures", "failure", failure.name()).increment();
    }

    public void recordEntryPosted(SourceType sourceType) {
        registry.counter("ledger.entries.posted", "source_type", sourceType.name()).increment();
    }

    public void recordEntryVoided(String mode) {
        registry.counter("ledger.entries.voided", "mode", sanitizeTag(mode)).increment();
    }

    public void recordEntryReconciled() {
        registry.counter("ledger.entries.reconciled").increment();
    }

    // Statements

    public void recordStatementIngested(boolean lowTrust, int transactionCount) {
        registry.counter("statements.ingested", "low_trust", String.valueOf(lowTrust)).increment();
        registry.counter("statements.transactions.ingested").increment(transactionCount);
    }

    // Matching

    public <T> T timeTransactionMatch(Supplier<T> work) {
        return transactionMatchTimer.record(work);
    }

    public void recordRouting(RoutingDecision decision) {
        registry.counter("reconciliation.routing",
            "outcome", decision.getOutcome().name(),
            "capped_by", decision.isCapped() ? decision.getCappedBy().name() : "none"
        ).increment();
    }

    public void recordMatchCreated(MatchStatus status, int score) {
        registry.counter("reconciliation.matches.created", "status", status.name()).increment();
        matchScores.record(score);
    }

    public void recordMatchResolved(MatchStatus status, String path) {
        registry.counter("reconciliation.matches.resolved",
            "status", status.name(),
            "path", sanitizeTag(path)
        ).increment();
    }

    public void recordMatchSuperseded() {
        registry.counter("reconciliation.matches.superseded").increment();
    }

    public void recordTransactionFailed() {
        registry.counter("reconciliation.transactions.failed").increment();
    }

    public void recordRunFinished(RunStatus status, Duration duration) {
        registry.timer("reconciliation.runs", "status", status.name()).record(duration);
    }

    public void recordBatchItem(String operation, String result) {
        registry.counter("reconciliation.batch.items",
            "operation", sanitizeTag(operation),
            "result", sanitizeTag(result)
        ).increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    // Consistency

    public void recordCheckRaised(CheckType type, Severity severity) {
        registry.counter("consistency.checks.raised", "type", type.name(), "severity", severity.name()).increment();
    }

    public void recordCheckResolved(ResolutionAction action) {
        registry.counter("consistency.checks.resolved", "action", action.name()).increment();
    }

    // Consumer

    public void recordEventProcessed(String eventType, boolean wasNew) {
        registry.counter("event.processed",
            "event_type", sanitizeTag(eventType),
            "was_new", String.valueOf(wasNew)
        ).increment();
    }

    public void recordEventProcessingFailure(String eventType, String error) {
        registry.counter("event.processing.failure",
            "event_type", sanitizeTag(eventType),
            "error", sanitizeTag(error)
        ).increment();
    }

    static String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
