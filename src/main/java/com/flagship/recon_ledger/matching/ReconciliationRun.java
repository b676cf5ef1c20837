package com.flagship.recon_ledger.matching;

import com.flagship.recon_ledger.statement.ReconciliationScope;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One pass of the matcher over a scope of bank transactions.
 */
@Value
@Builder(toBuilder = true)
public class ReconciliationRun {
    UUID id;
    ReconciliationScope scope;
    RunStatus status;
    String idempotencyKey;
    RunSummary summary;
    Instant startedAt;
    Instant finishedAt;

    public static ReconciliationRun start(ReconciliationScope scope, String idempotencyKey) {
        return ReconciliationRun.builder()
            .id(UUID.randomUUID())
            .scope(scope)
            .status(RunStatus.RUNNING)
            .idempotencyKey(idempotencyKey)
            .summary(RunSummary.empty())
            .startedAt(Instant.now())
            .build();
    }

    public ReconciliationRun finish(RunStatus finalStatus, RunSummary finalSummary) {
        if (status.isFinished()) {
            throw new IllegalStateException("Run " + id + " already finished as " + status);
        }
        if (!finalStatus.isFinished()) {
            throw new IllegalArgumentException("Cannot finish a run as " + finalStatus);
        }
        return toBuilder().status(finalStatus).summary(finalSummary).finishedAt(Instant.now()).build();
    }
}
