package com.flagship.recon_ledger.matching;

import com.flagship.recon_ledger.config.ReconciliationProperties;
import com.flagship.recon_ledger.statement.IngestionResult;
import com.flagship.recon_ledger.statement.ReconciliationScope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Runs the matcher over a freshly ingested batch when auto-run is enabled.
 *
 * Must be called after the ingestion transaction has committed; the matcher works in
 * its own transactions and would not see uncommitted rows.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StatementAutoRunner {

    private final ReconciliationProperties properties;
    private final ReconciliationRunService runService;

    public Optional<ReconciliationRun> afterIngest(IngestionResult result) {
        if (!properties.isAutoRunOnIngest()) {
            return Optional.empty();
        }
        log.debug("Auto-running matcher for batch {}", result.getBatch().getId());
        return Optional.of(runService.run(ReconciliationScope.batch(result.getBatch().getId()), null));
    }
}
