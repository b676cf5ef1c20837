package com.flagship.recon_ledger.consumer;

import com.flagship.recon_ledger.matching.ReconciliationRun;
import com.flagship.recon_ledger.matching.StatementAutoRunner;
import com.flagship.recon_ledger.statement.IngestionResult;
import com.flagship.recon_ledger.statement.StatementIngestionService;
import com.flagship.recon_ledger.statement.dto.StatementSubmissionRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Ingests statements arriving from the extractor.
 */
@Service
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class StatementExtractionHandler {

    private final StatementIngestionService ingestionService;
    private final StatementAutoRunner autoRunner;

    /**
     * Runs inside the idempotent processor's transaction.
     */
    public IngestionResult ingest(StatementSubmissionRequest statement) {
        IngestionResult result = ingestionService.ingest(statement.toExtraction());
        log.info("Ingested extracted statement: batchId={}, transactions={}, lowTrust={}",
            result.getBatch().getId(), result.getTransactionIds().size(), result.getBatch().isLowTrust());
        return result;
    }

    /**
     * Called once the ingestion has committed.
     */
    public void afterCommit(IngestionResult result) {
        Optional<ReconciliationRun> run = autoRunner.afterIngest(result);
        run.ifPresent(r -> log.info("Auto-run after ingestion: batchId={}, runId={}, status={}",
            result.getBatch().getId(), r.getId(), r.getStatus()));
    }
}
